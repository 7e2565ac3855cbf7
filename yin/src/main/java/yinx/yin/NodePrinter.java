//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.yin;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import java.util.Set;
import yinx.expr.ExprTranslator;
import yinx.model.*;
import yinx.model.Module;

import static yinx.model.Node.Kind.*;

/**
 * Prints schema nodes and the definitions that hang off them (features, identities, refines,
 * deviations and augments).
 *
 * <p>Every node emitter prints its substatements in a fixed order and then recurses into its
 * children, restricted to the kinds that the YANG grammar permits under it. Children injected by
 * an augment, including those belonging to a different module than their parent, are printed
 * under that augment instead.</p>
 */
abstract class NodePrinter extends StmtPrinter {

  /** Kinds permitted in a data definition body: module, container, list, grouping, input,
    * output, notification. */
  static final Set<Node.Kind> DATA_MASK = Sets.immutableEnumSet(
    CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, GROUPING, ANYXML);

  /** Kinds permitted under a case. */
  static final Set<Node.Kind> CASE_MASK = Sets.immutableEnumSet(
    CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, ANYXML);

  /** Kinds permitted under a choice (cases and shorthand cases). */
  static final Set<Node.Kind> CHOICE_MASK = Sets.immutableEnumSet(
    CONTAINER, LEAF, LEAF_LIST, LIST, ANYXML, CASE);

  /** Kinds permitted under an augment. */
  static final Set<Node.Kind> AUGMENT_MASK = Sets.immutableEnumSet(
    CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, ANYXML, CASE);

  /** Kinds permitted under an rpc. */
  static final Set<Node.Kind> RPC_MASK = Sets.immutableEnumSet(GROUPING, INPUT, OUTPUT);

  /** Kinds permitted at the top level of a module. */
  static final Set<Node.Kind> MODULE_MASK = Sets.immutableEnumSet(
    CHOICE, CONTAINER, LEAF, LEAF_LIST, LIST, USES, GROUPING, ANYXML, RPC, NOTIFICATION);

  protected NodePrinter (Emitter out, ExprTranslator xlate, int maxDepth) {
    super(out, xlate, maxDepth);
  }

  /** Prints {@code node}, which must be of a kind in {@code mask}. */
  void printNode (int level, Node node, Set<Node.Kind> mask) throws PrintException {
    Preconditions.checkState(mask.contains(node.kind), "%s is not permitted here (%s)",
                             node, node.parent());
    checkDepth(level, node);
    switch (node.kind) {
    case CONTAINER: printContainer(level, (ContainerNode)node); break;
    case CHOICE: printChoice(level, (ChoiceNode)node); break;
    case CASE: printCase(level, (CaseNode)node); break;
    case LEAF: printLeaf(level, (LeafNode)node); break;
    case LEAF_LIST: printLeafList(level, (LeafListNode)node); break;
    case LIST: printList(level, (ListNode)node); break;
    case USES: printUses(level, (UsesNode)node); break;
    case GROUPING: printGrouping(level, (GroupingNode)node); break;
    case ANYXML: printAnyxml(level, (AnyxmlNode)node); break;
    case INPUT:
    case OUTPUT: printInOut(level, (InOutNode)node); break;
    case RPC: printRpc(level, (RpcNode)node); break;
    case NOTIFICATION: printNotification(level, (NotificationNode)node); break;
    default: throw new AssertionError("Unknown node kind " + node.kind);
    }
  }

  /** Prints the children of {@code node} that were declared in place, in its module. */
  void printChildren (int level, Node node, Set<Node.Kind> mask) throws PrintException {
    for (Node child : node.children()) {
      // injected by an augment (printed there) or contributed by another (sub)module
      if (child.augment() != null || child.module != node.module) continue;
      printNode(level, child, mask);
    }
  }

  void printContainer (int level, ContainerNode cont) throws PrintException {
    Module module = cont.module;
    int sub = level+1;
    _out.open(level, "container", "name", cont.name, false);
    printNacm(sub, cont);
    if (cont.when != null) printWhen(sub, module, cont.when);
    for (Feature feat : cont.ifFeatures) printIfFeature(sub, module, feat);
    for (Restriction must : cont.musts) printMust(sub, module, must);
    if (cont.presence != null) _out.open(sub, "presence", "value", cont.presence, true);
    printCommon2(sub, cont);
    for (Typedef tpdf : cont.typedefs) printTypedef(sub, module, tpdf);
    printChildren(sub, cont, DATA_MASK);
    _out.close(level, "container");
  }

  void printChoice (int level, ChoiceNode choice) throws PrintException {
    Module module = choice.module;
    int sub = level+1;
    _out.open(level, "choice", "name", choice.name, false);
    printNacm(sub, choice);
    if (choice.when != null) printWhen(sub, module, choice.when);
    for (Feature feat : choice.ifFeatures) printIfFeature(sub, module, feat);
    if (choice.dflt != null) _out.open(sub, "default", "value", choice.dflt.name, true);
    printCommon2(sub, choice);
    printChildren(sub, choice, CHOICE_MASK);
    _out.close(level, "choice");
  }

  void printCase (int level, CaseNode cas) throws PrintException {
    Module module = cas.module;
    int sub = level+1;
    _out.open(level, "case", "name", cas.name, false);
    printNacm(sub, cas);
    if (cas.when != null) printWhen(sub, module, cas.when);
    for (Feature feat : cas.ifFeatures) printIfFeature(sub, module, feat);
    printCommon2(sub, cas);
    printChildren(sub, cas, CASE_MASK);
    _out.close(level, "case");
  }

  void printLeaf (int level, LeafNode leaf) throws PrintException {
    Module module = leaf.module;
    int sub = level+1;
    _out.open(level, "leaf", "name", leaf.name, false);
    printNacm(sub, leaf);
    if (leaf.when != null) printWhen(sub, module, leaf.when);
    for (Feature feat : leaf.ifFeatures) printIfFeature(sub, module, feat);
    for (Restriction must : leaf.musts) printMust(sub, module, must);
    printType(sub, module, leaf.type);
    if (leaf.units != null) _out.open(sub, "units", "name", leaf.units, true);
    if (leaf.dflt != null) _out.open(sub, "default", "value", leaf.dflt, true);
    printCommon2(sub, leaf);
    _out.close(level, "leaf");
  }

  void printLeafList (int level, LeafListNode llist) throws PrintException {
    Module module = llist.module;
    int sub = level+1;
    _out.open(level, "leaf-list", "name", llist.name, false);
    printNacm(sub, llist);
    if (llist.when != null) printWhen(sub, module, llist.when);
    for (Feature feat : llist.ifFeatures) printIfFeature(sub, module, feat);
    for (Restriction must : llist.musts) printMust(sub, module, must);
    printCommon2(sub, llist);
    printType(sub, module, llist.type);
    if (llist.units != null) _out.open(sub, "units", "name", llist.units, true);
    printElements(sub, llist.minElements, llist.maxElements, llist.userOrdered);
    _out.close(level, "leaf-list");
  }

  void printList (int level, ListNode list) throws PrintException {
    Module module = list.module;
    int sub = level+1;
    _out.open(level, "list", "name", list.name, false);
    printNacm(sub, list);
    if (list.when != null) printWhen(sub, module, list.when);
    for (Feature feat : list.ifFeatures) printIfFeature(sub, module, feat);
    for (Restriction must : list.musts) printMust(sub, module, must);
    if (!list.keys.isEmpty()) {
      _out.open(sub, "key", "value", SPACE.join(Lists.transform(list.keys, k -> k.name)), true);
    }
    for (Unique unique : list.uniques) printUnique(sub, unique);
    printCommon2(sub, list);
    printElements(sub, list.minElements, list.maxElements, list.userOrdered);
    for (Typedef tpdf : list.typedefs) printTypedef(sub, module, tpdf);
    printChildren(sub, list, DATA_MASK);
    _out.close(level, "list");
  }

  /** Returns true if {@link #printAnyxml} writes a body for {@code anyxml}. */
  static boolean hasAnyxmlBody (AnyxmlNode anyxml) {
    return (hasNacm(anyxml) || anyxml.when != null || !anyxml.ifFeatures.isEmpty() ||
            !anyxml.musts.isEmpty() || hasCommon2(anyxml));
  }

  void printAnyxml (int level, AnyxmlNode anyxml) throws PrintException {
    Module module = anyxml.module;
    int sub = level+1;
    boolean close = !hasAnyxmlBody(anyxml);
    _out.open(level, "anyxml", "name", anyxml.name, close);
    if (close) return;

    printNacm(sub, anyxml);
    if (anyxml.when != null) printWhen(sub, module, anyxml.when);
    for (Feature feat : anyxml.ifFeatures) printIfFeature(sub, module, feat);
    for (Restriction must : anyxml.musts) printMust(sub, module, must);
    printCommon2(sub, anyxml);
    _out.close(level, "anyxml");
  }

  /** Returns true if {@link #printUses} writes a body for {@code uses}. */
  static boolean hasUsesBody (UsesNode uses) {
    return (hasNacm(uses) || uses.when != null || !uses.ifFeatures.isEmpty() || hasCommon(uses) ||
            !uses.refines.isEmpty() || !uses.augments.isEmpty());
  }

  void printUses (int level, UsesNode uses) throws PrintException {
    Module module = uses.module;
    int sub = level+1;
    boolean close = !hasUsesBody(uses);
    _out.open(level, "uses", "name", qualify(module, uses.grouping.module, uses.name), close);
    if (close) return;

    printNacm(sub, uses);
    if (uses.when != null) printWhen(sub, module, uses.when);
    for (Feature feat : uses.ifFeatures) printIfFeature(sub, module, feat);
    printCommon(sub, uses);
    for (Refine refine : uses.refines) printRefine(sub, module, refine);
    for (Augment aug : uses.augments) printAugment(sub, aug);
    _out.close(level, "uses");
  }

  void printGrouping (int level, GroupingNode grp) throws PrintException {
    int sub = level+1;
    _out.open(level, "grouping", "name", grp.name, false);
    printCommon(sub, grp);
    for (Typedef tpdf : grp.typedefs) printTypedef(sub, grp.module, tpdf);
    printChildren(sub, grp, DATA_MASK);
    _out.close(level, "grouping");
  }

  void printInOut (int level, InOutNode inout) throws PrintException {
    int sub = level+1;
    _out.open(level, inout.kind.keyword);
    for (Typedef tpdf : inout.typedefs) printTypedef(sub, inout.module, tpdf);
    printChildren(sub, inout, DATA_MASK);
    _out.close(level, inout.kind.keyword);
  }

  void printRpc (int level, RpcNode rpc) throws PrintException {
    int sub = level+1;
    _out.open(level, "rpc", "name", rpc.name, false);
    for (Feature feat : rpc.ifFeatures) printIfFeature(sub, rpc.module, feat);
    printCommon(sub, rpc);
    for (Typedef tpdf : rpc.typedefs) printTypedef(sub, rpc.module, tpdf);
    printChildren(sub, rpc, RPC_MASK);
    _out.close(level, "rpc");
  }

  void printNotification (int level, NotificationNode notif) throws PrintException {
    int sub = level+1;
    _out.open(level, "notification", "name", notif.name, false);
    for (Feature feat : notif.ifFeatures) printIfFeature(sub, notif.module, feat);
    printCommon(sub, notif);
    for (Typedef tpdf : notif.typedefs) printTypedef(sub, notif.module, tpdf);
    printChildren(sub, notif, DATA_MASK);
    _out.close(level, "notification");
  }

  /** Returns true if {@link #printFeature} writes a body for {@code feat}. */
  static boolean hasFeatureBody (Feature feat) {
    return hasCommon(feat) || !feat.ifFeatures.isEmpty();
  }

  void printFeature (int level, Feature feat) {
    boolean close = !hasFeatureBody(feat);
    _out.open(level, "feature", "name", feat.name, close);
    if (close) return;

    printCommon(level+1, feat);
    for (Feature dep : feat.ifFeatures) printIfFeature(level+1, feat.module, dep);
    _out.close(level, "feature");
  }

  /** Returns true if {@link #printIdentity} writes a body for {@code ident}. */
  static boolean hasIdentityBody (Identity ident) {
    return hasCommon(ident) || ident.base != null;
  }

  void printIdentity (int level, Identity ident) {
    boolean close = !hasIdentityBody(ident);
    _out.open(level, "identity", "name", ident.name, close);
    if (close) return;

    printCommon(level+1, ident);
    if (ident.base != null) {
      _out.open(level+1, "base", "name", qualify(ident.module, ident.base.module, ident.base.name),
                true);
    }
    _out.close(level, "identity");
  }

  void printRefine (int level, Module module, Refine refine) throws PrintException {
    int sub = level+1;
    _out.open(level, "refine", "target-node", translatePath(module, refine.targetPath, "refine"),
              false);
    printConfigMandatory(sub, refine.config, refine.mandatory);
    printCommon(sub, refine);
    for (Restriction must : refine.musts) printMust(sub, module, must);

    switch (refine.targetKind) {
    case LEAF:
    case CHOICE:
      if (refine.dflt != null) _out.open(sub, "default", "value", refine.dflt, true);
      break;
    case CONTAINER:
      if (refine.presence != null) _out.open(sub, "presence", "value", refine.presence, true);
      break;
    case LIST:
    case LEAF_LIST:
      printMinMax(sub, refine.minElements, refine.maxElements);
      break;
    default:
      break;
    }
    _out.close(level, "refine");
  }

  void printDeviation (int level, Module module, Deviation deviation) throws PrintException {
    int sub = level+1;
    String target = translatePath(module, deviation.targetPath, "deviation");
    _out.open(level, "deviation", "target-node", target, false);
    if (deviation.description != null) _out.text(sub, "description", deviation.description);
    if (deviation.reference != null) _out.text(sub, "reference", deviation.reference);

    for (Deviation.Deviate dev : deviation.deviates) {
      _out.open(sub, "deviate", "value", dev.op.keyword, false);
      if (dev.op != Deviation.Op.NOT_SUPPORTED) printDeviate(sub+1, module, dev);
      _out.close(sub, "deviate");
    }
    _out.close(level, "deviation");
  }

  void printAugment (int level, Augment aug) throws PrintException {
    Module module = aug.module;
    int sub = level+1;
    _out.open(level, "augment", "target-node", translatePath(module, aug.targetPath, "augment"),
              false);
    printNacm(sub, module, aug.nacm);
    printCommon(sub, aug);
    for (Feature feat : aug.ifFeatures) printIfFeature(sub, module, feat);
    if (aug.when != null) printWhen(sub, module, aug.when);
    for (Node child : aug.children()) {
      if (child.module != module) continue;
      printNode(sub, child, AUGMENT_MASK);
    }
    _out.close(level, "augment");
  }

  private void printDeviate (int level, Module module, Deviation.Deviate dev)
      throws PrintException {
    printConfigMandatory(level, dev.config, dev.mandatory);
    if (dev.dflt != null) _out.open(level, "default", "value", dev.dflt, true);
    printMinMax(level, dev.minElements, dev.maxElements);
    for (Restriction must : dev.musts) printMust(level, module, must);
    for (Unique unique : dev.uniques) printUnique(level, unique);
    if (dev.type != null) printType(level, module, dev.type);
    if (dev.units != null) _out.open(level, "units", "name", dev.units, true);
  }

  private void printConfigMandatory (int level, Boolean config, Boolean mandatory) {
    if (config != null) _out.open(level, "config", "value", config.toString(), true);
    if (mandatory != null) _out.open(level, "mandatory", "value", mandatory.toString(), true);
  }

  /** Prints explicitly set element bounds; a max of zero is {@code unbounded}. */
  private void printMinMax (int level, Integer min, Integer max) {
    if (min != null) _out.unsigned(level, "min-elements", "value", min);
    if (max != null) {
      if (max == 0) _out.open(level, "max-elements", "value", "unbounded", true);
      else _out.unsigned(level, "max-elements", "value", max);
    }
  }

  /** Prints a list's or leaf-list's non-default bounds and ordering. */
  private void printElements (int level, int min, int max, boolean userOrdered) {
    if (min > 0) _out.unsigned(level, "min-elements", "value", min);
    if (max > 0) _out.unsigned(level, "max-elements", "value", max);
    if (userOrdered) _out.open(level, "ordered-by", "value", "user", true);
  }
}
