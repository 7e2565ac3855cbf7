//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/** A {@code leaf} node. */
public final class LeafNode extends Node {

  public final Type type;

  public When when;
  public final List<Restriction> musts = new ArrayList<>();
  public String units;

  /** The default value, or null. */
  public String dflt;

  public LeafNode (Module module, String name, Type type) {
    super(Kind.LEAF, module, name);
    this.type = Preconditions.checkNotNull(type, "type");
  }
}
