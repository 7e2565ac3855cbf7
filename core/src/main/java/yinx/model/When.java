//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;

/**
 * A {@code when} condition. The condition is kept in canonical (module name qualified) form.
 */
public final class When {

  public final String condition;
  public String description;
  public String reference;

  public When (String condition) {
    this.condition = Preconditions.checkNotNull(condition, "condition");
  }
}
