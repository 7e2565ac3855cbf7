//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

/** A {@code choice} node. Its children are cases or shorthand case nodes. */
public final class ChoiceNode extends Node {

  public When when;

  /** The default case, or null. */
  public Node dflt;

  public ChoiceNode (Module module, String name) {
    super(Kind.CHOICE, module, name);
  }
}
