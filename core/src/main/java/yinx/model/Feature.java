//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@code feature} declaration.
 */
public final class Feature extends Documented {

  /** The module (or submodule) that declares this feature. */
  public final Module module;

  public final String name;

  /** The features this feature depends on, printed as {@code if-feature} substatements. */
  public final List<Feature> ifFeatures = new ArrayList<>();

  public Feature (Module module, String name) {
    this.module = Preconditions.checkNotNull(module, "module");
    this.name = Preconditions.checkNotNull(name, "name");
  }

  @Override public String toString () {
    return "Feature(" + module.name + ":" + name + ")";
  }
}
