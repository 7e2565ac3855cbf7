//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;

/**
 * A constraint attached to a type or a node: a {@code range}, {@code length}, {@code pattern} or
 * {@code must} expression, along with its optional documentation and error reporting.
 */
public final class Restriction {

  /** The restricting expression. For a {@code must} this is in canonical (module name qualified)
    * form. */
  public final String expr;

  public String description;
  public String reference;

  /** The {@code error-app-tag} value, or null. */
  public String errorAppTag;

  /** The {@code error-message} value, or null. */
  public String errorMessage;

  public Restriction (String expr) {
    this.expr = Preconditions.checkNotNull(expr, "expr");
  }

  @Override public String toString () {
    return "Restriction(" + expr + ")";
  }
}
