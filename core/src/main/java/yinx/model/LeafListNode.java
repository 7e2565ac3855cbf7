//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/** A {@code leaf-list} node. */
public final class LeafListNode extends Node {

  public final Type type;

  public When when;
  public final List<Restriction> musts = new ArrayList<>();
  public String units;

  /** The minimum number of entries. Zero (the default) is not printed. */
  public int minElements;

  /** The maximum number of entries. Zero means unbounded (the default) and is not printed. */
  public int maxElements;

  /** Whether the entries are ordered by the user rather than the system. */
  public boolean userOrdered;

  public LeafListNode (Module module, String name, Type type) {
    super(Kind.LEAF_LIST, module, name);
    this.type = Preconditions.checkNotNull(type, "type");
  }
}
