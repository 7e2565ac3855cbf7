//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import java.util.ArrayList;
import java.util.List;

/** A {@code grouping} definition. */
public final class GroupingNode extends Node {

  public final List<Typedef> typedefs = new ArrayList<>();

  public GroupingNode (Module module, String name) {
    super(Kind.GROUPING, module, name);
  }
}
