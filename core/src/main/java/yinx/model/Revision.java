//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;

/** A {@code revision} entry of a module. */
public final class Revision {

  /** The revision date, {@code YYYY-MM-DD}. */
  public final String date;
  public String description;
  public String reference;

  public Revision (String date) {
    this.date = Preconditions.checkNotNull(date, "date");
  }
}
