//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import java.util.ArrayList;
import java.util.List;

/** A {@code list} node. */
public final class ListNode extends Node {

  public When when;
  public final List<Restriction> musts = new ArrayList<>();

  /** The key leaves, in key order. */
  public final List<LeafNode> keys = new ArrayList<>();

  public final List<Unique> uniques = new ArrayList<>();

  /** The minimum number of entries. Zero (the default) is not printed. */
  public int minElements;

  /** The maximum number of entries. Zero means unbounded (the default) and is not printed. */
  public int maxElements;

  /** Whether the entries are ordered by the user rather than the system. */
  public boolean userOrdered;

  public final List<Typedef> typedefs = new ArrayList<>();

  public ListNode (Module module, String name) {
    super(Kind.LIST, module, name);
  }
}
