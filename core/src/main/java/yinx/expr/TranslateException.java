//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.expr;

/**
 * Thrown when an expression cannot be re-expressed in the prefix namespace of a module.
 */
public class TranslateException extends Exception {

  public TranslateException (String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
