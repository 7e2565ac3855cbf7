//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.yin;

import yinx.expr.ExprTranslator;
import yinx.model.*;
import yinx.model.Module;

/**
 * Prints a complete YIN document for a module or submodule. The statements are written in the
 * following order:
 *
 * <ul>
 * <li>the XML declaration, and a comment if the module is deviated by another module</li>
 * <li>the root element with the YIN namespace, the module's own namespace and the namespace of
 * every declared import</li>
 * <li>header: yang-version, namespace and prefix (module) or belongs-to (submodule)</li>
 * <li>linkage: imports, then includes</li>
 * <li>meta: organization, contact, description, reference</li>
 * <li>revisions</li>
 * <li>body: features, identities, typedefs, deviations, data nodes, augments</li>
 * </ul>
 */
class ModulePrinter extends NodePrinter {

  public static final String YIN_NAMESPACE = "urn:ietf:params:xml:ns:yang:yin:1";

  ModulePrinter (Emitter out, ExprTranslator xlate, int maxDepth) {
    super(out, xlate, maxDepth);
  }

  void printModule (Module module) throws PrintException {
    _out.raw("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
    if (module.deviated) _out.raw("<!-- DEVIATED -->\n");

    String root = module.isSubmodule() ? "submodule" : "module";
    _out.rootStart(root, "name", module.name);
    printNamespaces(module);
    _out.rootEnd();

    int level = 1;
    printHeader(level, module);
    printLinkage(level, module);
    if (module.organization != null) _out.text(level, "organization", module.organization);
    if (module.contact != null) _out.text(level, "contact", module.contact);
    if (module.description != null) _out.text(level, "description", module.description);
    if (module.reference != null) _out.text(level, "reference", module.reference);
    for (Revision rev : module.revisions) printRevision(level, rev);
    printBody(level, module);

    _out.close(0, root);
  }

  protected void printNamespaces (Module module) {
    int column = module.isSubmodule() ? 11 : 8;
    _out.rootAttr(column, "xmlns", YIN_NAMESPACE);
    if (!module.isSubmodule()) _out.rootAttr(column, "xmlns:" + module.prefix, module.namespace);
    for (Import imp : module.imports) {
      if (imp.external) continue;
      _out.rootAttr(column, "xmlns:" + imp.prefix, imp.module.namespace);
    }
  }

  protected void printHeader (int level, Module module) {
    if (module.isSubmodule()) {
      // a submodule always states the version of the module it belongs to
      YangVersion version = module.belongsTo.version != null ? module.belongsTo.version :
        module.version;
      if (module.version != null) _out.open(level, "yang-version", "value", version.keyword, true);
      _out.open(level, "belongs-to", "module", module.belongsTo.name, false);
      _out.open(level+1, "prefix", "value", module.prefix, true);
      _out.close(level, "belongs-to");
    } else {
      if (module.version != null) {
        _out.open(level, "yang-version", "value", module.version.keyword, true);
      }
      _out.open(level, "namespace", "uri", module.namespace, true);
      _out.open(level, "prefix", "value", module.prefix, true);
    }
  }

  protected void printLinkage (int level, Module module) {
    for (Import imp : module.imports) {
      if (imp.external) continue;
      _out.open(level, "import", "module", imp.module.name, false);
      _out.open(level+1, "prefix", "value", imp.prefix, true);
      if (imp.revision != null) _out.open(level+1, "revision-date", "date", imp.revision, true);
      _out.close(level, "import");
    }
    for (Include inc : module.includes) {
      if (inc.external) continue;
      boolean close = (inc.revision == null);
      _out.open(level, "include", "module", inc.submodule.name, close);
      if (!close) {
        _out.open(level+1, "revision-date", "date", inc.revision, true);
        _out.close(level, "include");
      }
    }
  }

  protected void printRevision (int level, Revision rev) {
    boolean close = (rev.description == null && rev.reference == null);
    _out.open(level, "revision", "date", rev.date, close);
    if (close) return;
    if (rev.description != null) _out.text(level+1, "description", rev.description);
    if (rev.reference != null) _out.text(level+1, "reference", rev.reference);
    _out.close(level, "revision");
  }

  protected void printBody (int level, Module module) throws PrintException {
    for (Feature feat : module.features) printFeature(level, feat);
    for (Identity ident : module.identities) printIdentity(level, ident);
    for (Typedef tpdf : module.typedefs) printTypedef(level, module, tpdf);
    for (Deviation dev : module.deviations) printDeviation(level, module, dev);
    for (Node node : module.data()) {
      // injected nodes print under their augment, submodule nodes with their submodule
      if (node.augment() != null || node.module != module) continue;
      printNode(level, node, MODULE_MASK);
    }
    for (Augment aug : module.augments) printAugment(level, aug);
  }
}
