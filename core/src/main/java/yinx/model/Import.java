//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;

/**
 * An {@code import} of another module.
 */
public final class Import {

  /** The imported module. */
  public final Module module;

  /** The prefix under which the importing module refers to {@link #module}. */
  public final String prefix;

  /** The imported revision, or null for any revision. */
  public String revision;

  /** Whether this import was added implicitly (for instance to resolve a deviation) rather than
    * declared in the module text. External imports are not printed. */
  public boolean external;

  public Import (Module module, String prefix) {
    Preconditions.checkArgument(!module.isSubmodule(), "Cannot import submodule %s", module.name);
    this.module = module;
    this.prefix = Preconditions.checkNotNull(prefix, "prefix");
  }

  @Override public String toString () {
    return "Import(" + module.name + " as " + prefix + ")";
  }
}
