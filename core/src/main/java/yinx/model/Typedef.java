//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;

/**
 * A named, reusable type definition.
 */
public final class Typedef extends Documented {

  /** The module (or submodule) in which this typedef is defined. */
  public final Module module;

  public final String name;

  /** The type from which this typedef is derived. */
  public final Type type;

  /** The {@code units} of values of this type, or null. */
  public String units;

  /** The default value, or null. */
  public String dflt;

  public Typedef (Module module, String name, Type type) {
    this.module = Preconditions.checkNotNull(module, "module");
    this.name = Preconditions.checkNotNull(name, "name");
    this.type = Preconditions.checkNotNull(type, "type");
  }

  @Override public String toString () {
    return "Typedef(" + module.name + ":" + name + ")";
  }
}
