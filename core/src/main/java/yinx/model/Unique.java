//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A list's {@code unique} statement: the descendant paths whose combined values must be unique.
 */
public final class Unique {

  /** The member paths, in declared order. */
  public final List<String> paths;

  public Unique (String... paths) {
    Preconditions.checkArgument(paths.length > 0, "unique requires at least one path");
    this.paths = ImmutableList.copyOf(paths);
  }
}
