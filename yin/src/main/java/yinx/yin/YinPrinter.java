//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.yin;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import yinx.expr.ExprTranslator;
import yinx.expr.ModuleNameTranslator;
import yinx.model.Module;

/**
 * Renders a {@link Module} as a YIN document. Configure via the fluent methods, then call one of
 * the {@code print} methods:
 *
 * <pre>{@code
 * String yin = new YinPrinter().maxDepth(64).print(module);
 * }</pre>
 *
 * The whole document is rendered in memory before anything is written to a sink, so a failed
 * print leaves the sink untouched. A printer may be reused but is not thread safe.
 */
public class YinPrinter {

  /** The default ceiling on element nesting. */
  public static final int DEFAULT_MAX_DEPTH = 256;

  /** Creates a printer which translates expressions with a {@link ModuleNameTranslator}. */
  public YinPrinter () {
    this(new ModuleNameTranslator());
  }

  public YinPrinter (ExprTranslator xlate) {
    _xlate = Preconditions.checkNotNull(xlate, "xlate");
  }

  /** Configures the translator used for XPath expressions and schema node paths. */
  public YinPrinter translator (ExprTranslator xlate) {
    _xlate = Preconditions.checkNotNull(xlate, "xlate");
    return this;
  }

  /** Configures the deepest element nesting the printer will produce before giving up with a
    * {@link PrintException}. */
  public YinPrinter maxDepth (int maxDepth) {
    Preconditions.checkArgument(maxDepth > 0, "maxDepth must be positive: %s", maxDepth);
    _maxDepth = maxDepth;
    return this;
  }

  public int maxDepth () { return _maxDepth; }

  /** Returns the YIN document for {@code module}. */
  public String print (Module module) throws PrintException {
    StringBuilder sb = new StringBuilder();
    new ModulePrinter(new Emitter(sb), _xlate, _maxDepth).printModule(module);
    return sb.toString();
  }

  /** Writes the YIN document for {@code module} to {@code out}. */
  public void print (Module module, Appendable out) throws PrintException, IOException {
    out.append(print(module));
  }

  /** Writes the YIN document for {@code module} to {@code out}, encoded as UTF-8. The stream is
    * flushed but not closed. */
  public void print (Module module, OutputStream out) throws PrintException, IOException {
    String doc = print(module);
    Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
    writer.write(doc);
    writer.flush();
  }

  private ExprTranslator _xlate;
  private int _maxDepth = DEFAULT_MAX_DEPTH;
}
