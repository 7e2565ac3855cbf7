//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.yin;

/**
 * Thrown when a module cannot be rendered as YIN: an expression could not be translated into the
 * module's prefix namespace, or the schema nests deeper than the printer allows. When this is
 * thrown, nothing has been written to the caller's sink.
 */
public class PrintException extends Exception {

  public PrintException (String message) {
    super(message);
  }

  public PrintException (String message, Throwable cause) {
    super(message, cause);
  }

  private static final long serialVersionUID = 1L;
}
