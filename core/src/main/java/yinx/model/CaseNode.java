//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

/** A {@code case} of a choice. */
public final class CaseNode extends Node {

  public When when;

  public CaseNode (Module module, String name) {
    super(Kind.CASE, module, name);
  }
}
