//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;

/**
 * An {@code identity} declaration.
 */
public final class Identity extends Documented {

  /** The module (or submodule) that declares this identity. */
  public final Module module;

  public final String name;

  /** The identity from which this one is derived, or null. */
  public Identity base;

  public Identity (Module module, String name) {
    this.module = Preconditions.checkNotNull(module, "module");
    this.name = Preconditions.checkNotNull(name, "name");
  }

  @Override public String toString () {
    return "Identity(" + module.name + ":" + name + ")";
  }
}
