//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

/**
 * The values of the YANG {@code status} statement.
 */
public enum Status {

  /** The default status. Never printed. */
  CURRENT("current"),
  DEPRECATED("deprecated"),
  OBSOLETE("obsolete");

  /** The keyword used for this status in YANG and YIN. */
  public final String keyword;

  Status (String keyword) {
    this.keyword = keyword;
  }
}
