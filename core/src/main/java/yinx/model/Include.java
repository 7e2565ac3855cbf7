//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;

/**
 * An {@code include} of a submodule.
 */
public final class Include {

  /** The included submodule. */
  public final Module submodule;

  /** The included revision, or null for any revision. */
  public String revision;

  /** Whether this include was added implicitly rather than declared. External includes are not
    * printed. */
  public boolean external;

  public Include (Module submodule) {
    Preconditions.checkArgument(submodule.isSubmodule(), "%s is not a submodule", submodule.name);
    this.submodule = submodule;
  }
}
