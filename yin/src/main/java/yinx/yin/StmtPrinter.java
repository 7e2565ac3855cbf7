//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.yin;

import com.google.common.base.Joiner;
import java.util.Optional;
import java.util.Set;
import yinx.expr.ExprTranslator;
import yinx.expr.TranslateException;
import yinx.model.*;
import yinx.model.Module;

/**
 * Prints the substatements shared by many statements: status, description and reference; config
 * and mandatory; NACM markers; {@code if-feature}, {@code when} and {@code must}; restrictions,
 * types and typedefs.
 *
 * <p>Each {@code hasX} predicate returns true exactly when the matching {@code printX} would write
 * at least one element. Parents use the predicates to decide whether they can self-close.</p>
 */
abstract class StmtPrinter {

  protected StmtPrinter (Emitter out, ExprTranslator xlate, int maxDepth) {
    _out = out;
    _xlate = xlate;
    _maxDepth = maxDepth;
  }

  /** Returns true if {@link #printCommon} writes anything for {@code doc}. */
  static boolean hasCommon (Documented doc) {
    return doc.status != Status.CURRENT || doc.description != null || doc.reference != null;
  }

  /** Prints status (unless current), description and reference. */
  void printCommon (int level, Documented doc) {
    if (doc.status != Status.CURRENT) _out.open(level, "status", "value", doc.status.keyword, true);
    if (doc.description != null) _out.text(level, "description", doc.description);
    if (doc.reference != null) _out.text(level, "reference", doc.reference);
  }

  /** Returns true if {@link #printCommon2} writes anything for {@code node}. */
  static boolean hasCommon2 (Node node) {
    return printsConfig(node) || node.mandatory != null || hasCommon(node);
  }

  /** Prints config (when it differs from the parent's, or is false on a top-level node),
    * mandatory (when declared), then the common substatements. */
  void printCommon2 (int level, Node node) {
    if (printsConfig(node)) {
      _out.open(level, "config", "value", String.valueOf(node.effectiveConfig()), true);
    }
    if (node.mandatory != null) {
      _out.open(level, "mandatory", "value", node.mandatory.toString(), true);
    }
    printCommon(level, node);
  }

  /** Returns true if {@link #printNacm} writes anything for {@code node}. */
  static boolean hasNacm (Node node) {
    return !node.introducedNacm().isEmpty();
  }

  /** Prints the NACM markers {@code node} introduces relative to its parent. */
  void printNacm (int level, Node node) {
    printNacm(level, node.module, node.introducedNacm());
  }

  /** Prints a default-deny element for each of {@code markers}. The prefix is resolved through
    * {@code module}, its imports and the imports of its includes; the element is written
    * unprefixed if none of them reach the NACM module. */
  void printNacm (int level, Module module, Set<NacmDefault> markers) {
    if (markers.isEmpty()) return;
    Optional<String> prefix = module.prefixFor(NacmDefault.MODULE);
    if (!prefix.isPresent()) warnUnresolved(module, NacmDefault.MODULE);
    for (NacmDefault marker : markers) {
      _out.empty(level, prefix.isPresent() ? prefix.get() + ":" + marker.keyword : marker.keyword);
    }
  }

  void printIfFeature (int level, Module module, Feature feature) {
    _out.open(level, "if-feature", "name", qualify(module, feature.module, feature.name), true);
  }

  void printWhen (int level, Module module, When when) throws PrintException {
    boolean close = (when.description == null && when.reference == null);
    String cond = translate(module, when.condition, "when");
    _out.open(level, "when", "condition", cond, close);
    if (!close) {
      if (when.description != null) _out.text(level+1, "description", when.description);
      if (when.reference != null) _out.text(level+1, "reference", when.reference);
      _out.close(level, "when");
    }
  }

  void printMust (int level, Module module, Restriction must) throws PrintException {
    boolean close = !hasRestrictionSub(must);
    String cond = translate(module, must.expr, "must");
    _out.open(level, "must", "condition", cond, close);
    if (!close) {
      printRestrictionSub(level+1, must);
      _out.close(level, "must");
    }
  }

  /** Returns true if {@code restr} has any of description, reference, error-app-tag or
    * error-message. */
  static boolean hasRestrictionSub (Restriction restr) {
    return (restr.description != null || restr.reference != null ||
            restr.errorAppTag != null || restr.errorMessage != null);
  }

  /** Prints {@code restr} as element {@code elem} ({@code range}, {@code length} or
    * {@code pattern}). */
  void printRestriction (int level, String elem, Restriction restr) {
    boolean close = !hasRestrictionSub(restr);
    _out.open(level, elem, "value", restr.expr, close);
    if (!close) {
      printRestrictionSub(level+1, restr);
      _out.close(level, elem);
    }
  }

  void printUnique (int level, Unique unique) {
    _out.open(level, "unique", "tag", SPACE.join(unique.paths), true);
  }

  void printTypedef (int level, Module module, Typedef tpdf) throws PrintException {
    _out.open(level, "typedef", "name", tpdf.name, false);
    printCommon(level+1, tpdf);
    printType(level+1, module, tpdf.type);
    if (tpdf.units != null) _out.open(level+1, "units", "name", tpdf.units, true);
    if (tpdf.dflt != null) _out.open(level+1, "default", "value", tpdf.dflt, true);
    _out.close(level, "typedef");
  }

  /** Returns true if {@link #printType} writes a body for {@code type}. */
  static boolean hasTypeBody (Type type) {
    switch (type.base) {
    case BOOLEAN:
    case EMPTY:
      return false;
    case BINARY:
      return ((Type.Binary)type).length != null;
    case INSTANCE_IDENTIFIER:
      return ((Type.InstanceId)type).requireInstance != null;
    case STRING:
      Type.StringType str = (Type.StringType)type;
      return str.length != null || !str.patterns.isEmpty();
    case DECIMAL64:
    case ENUMERATION:
    case IDENTITYREF:
    case BITS:
    case UNION:
    case LEAFREF:
      return true;
    default:
      if (type.base.isInteger()) return ((Type.Numeric)type).range != null;
      throw new AssertionError("Unknown base type " + type.base);
    }
  }

  void printType (int level, Module module, Type type) throws PrintException {
    checkDepth(level, type);
    boolean close = !hasTypeBody(type);
    String name = (type.derived == null) ? type.base.keyword :
      qualify(module, type.derived.module, type.derived.name);
    _out.open(level, "type", "name", name, close);
    if (close) return;

    int sub = level+1;
    switch (type.base) {
    case BINARY:
      printRestriction(sub, "length", ((Type.Binary)type).length);
      break;

    case BITS:
      for (Type.Bit bit : ((Type.Bits)type).bits) {
        _out.open(sub, "bit", "name", bit.name, false);
        printCommon(sub+1, bit);
        _out.unsigned(sub+1, "position", "value", bit.position);
        _out.close(sub, "bit");
      }
      break;

    case DECIMAL64:
      Type.Decimal64 dec = (Type.Decimal64)type;
      _out.unsigned(sub, "fraction-digits", "value", dec.fractionDigits);
      if (dec.range != null) printRestriction(sub, "range", dec.range);
      break;

    case ENUMERATION:
      for (Type.EnumValue enm : ((Type.Enumeration)type).enums) {
        _out.open(sub, "enum", "name", enm.name, false);
        printCommon(sub+1, enm);
        _out.open(sub+1, "value", "value", Integer.toString(enm.value), true);
        _out.close(sub, "enum");
      }
      break;

    case IDENTITYREF:
      Identity base = ((Type.IdentityRef)type).base;
      _out.open(sub, "base", "name", qualify(module, base.module, base.name), true);
      break;

    case INSTANCE_IDENTIFIER:
      _out.open(sub, "require-instance", "value",
                ((Type.InstanceId)type).requireInstance.toString(), true);
      break;

    case LEAFREF:
      String path = translate(module, ((Type.LeafRef)type).path, "leafref path");
      _out.open(sub, "path", "value", path, true);
      break;

    case STRING:
      Type.StringType str = (Type.StringType)type;
      if (str.length != null) printRestriction(sub, "length", str.length);
      for (Restriction pattern : str.patterns) printRestriction(sub, "pattern", pattern);
      break;

    case UNION:
      for (Type member : ((Type.Union)type).types) printType(sub, module, member);
      break;

    default:
      printRestriction(sub, "range", ((Type.Numeric)type).range);
      break;
    }
    _out.close(level, "type");
  }

  /** Returns {@code name} qualified with the prefix under which {@code module} imports
    * {@code owner}, or bare if {@code owner} and {@code module} share a main module. Only the
    * direct imports of {@code module} are searched. */
  protected String qualify (Module module, Module owner, String name) {
    Module target = owner.mainModule();
    if (target == module.mainModule()) return name;
    Optional<String> prefix = module.importPrefix(target.name);
    if (!prefix.isPresent()) {
      warnUnresolved(module, target.name);
      return name;
    }
    return prefix.get() + ":" + name;
  }

  /** Translates an XPath expression into {@code module}'s prefix namespace. */
  protected String translate (Module module, String expr, String what) throws PrintException {
    try {
      return _xlate.toSchema(module, expr);
    } catch (TranslateException te) {
      throw new PrintException("Cannot translate " + what + " '" + expr + "' of " + module +
                               ": " + te.getMessage(), te);
    }
  }

  /** Translates a schema node path into prefix-qualified form. */
  protected String translatePath (Module module, String path, String what)
      throws PrintException {
    try {
      return _xlate.toXmlPath(module, path);
    } catch (TranslateException te) {
      throw new PrintException("Cannot translate " + what + " target '" + path + "' of " +
                               module + ": " + te.getMessage(), te);
    }
  }

  protected void checkDepth (int level, Object what) throws PrintException {
    if (level > _maxDepth) throw new PrintException(
      "Nesting of " + what + " exceeds " + _maxDepth + " levels");
  }

  private void printRestrictionSub (int level, Restriction restr) {
    if (restr.description != null) _out.text(level, "description", restr.description);
    if (restr.reference != null) _out.text(level, "reference", restr.reference);
    if (restr.errorAppTag != null) {
      _out.open(level, "error-app-tag", "value", restr.errorAppTag, true);
    }
    if (restr.errorMessage != null) {
      _out.wrapped(level, "error-message", "value", restr.errorMessage);
    }
  }

  private static boolean printsConfig (Node node) {
    Node parent = node.parent();
    if (parent == null) return !node.effectiveConfig();
    return node.effectiveConfig() != parent.effectiveConfig();
  }

  private static void warnUnresolved (Module module, String target) {
    System.err.println("No prefix for module '" + target + "' in " + module +
                       ", printing reference unqualified");
  }

  protected static final Joiner SPACE = Joiner.on(' ');

  protected final Emitter _out;
  protected final ExprTranslator _xlate;
  protected final int _maxDepth;
}
