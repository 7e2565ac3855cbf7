//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@code uses} of a grouping. The nodes instantiated from the grouping are not printed under the
 * uses; only the uses statement itself, with its refinements and augmentations.
 */
public final class UsesNode extends Node {

  /** The grouping being instantiated. */
  public final GroupingNode grouping;

  public When when;
  public final List<Refine> refines = new ArrayList<>();
  public final List<Augment> augments = new ArrayList<>();

  public UsesNode (Module module, GroupingNode grouping) {
    super(Kind.USES, module, Preconditions.checkNotNull(grouping, "grouping").name);
    this.grouping = grouping;
  }
}
