//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

/**
 * Base for statements that carry the shared {@code status}, {@code description} and
 * {@code reference} substatements.
 */
public abstract class Documented {

  /** The status of this statement. {@link Status#CURRENT} is the default. */
  public Status status = Status.CURRENT;

  /** The description text, or null. */
  public String description;

  /** The reference text, or null. */
  public String reference;
}
