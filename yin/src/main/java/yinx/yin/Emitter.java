//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.yin;

import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;

/**
 * Writes YIN elements, one per line, into a buffer. Every method takes the nesting level of the
 * element it writes; each level indents by two spaces.
 */
final class Emitter {

  Emitter (StringBuilder out) {
    _out = out;
  }

  /** Writes {@code <elem attr="value">}, or {@code <elem attr="value"/>} if {@code close}. */
  void open (int level, String elem, String attr, String value, boolean close) {
    indent(level).append('<').append(elem).append(' ').append(attr).append("=\"")
      .append(ATTR.escape(value)).append('"').append(close ? "/>" : ">").append('\n');
  }

  /** Writes {@code <elem>}. */
  void open (int level, String elem) {
    indent(level).append('<').append(elem).append(">\n");
  }

  /** Writes {@code <elem/>}. */
  void empty (int level, String elem) {
    indent(level).append('<').append(elem).append("/>\n");
  }

  /** Writes {@code </elem>}. */
  void close (int level, String elem) {
    indent(level).append("</").append(elem).append(">\n");
  }

  /** Writes {@code elem} containing a {@code text} element with {@code text} as character data. */
  void text (int level, String elem, String text) {
    wrapped(level, elem, "text", text);
  }

  /** Writes {@code elem} containing an {@code inner} element with {@code text} as character
    * data. */
  void wrapped (int level, String elem, String inner, String text) {
    open(level, elem);
    indent(level+1).append('<').append(inner).append('>').append(TEXT.escape(text))
      .append("</").append(inner).append(">\n");
    close(level, elem);
  }

  /** Writes {@code <elem attr="value"/>} for a non-negative integer value. */
  void unsigned (int level, String elem, String attr, long value) {
    if (value < 0) throw new IllegalArgumentException(elem + " requires unsigned value: " + value);
    open(level, elem, attr, Long.toString(value), true);
  }

  /** Writes the unterminated start tag {@code <elem attr="value"} of a document root. */
  void rootStart (String elem, String attr, String value) {
    _out.append('<').append(elem).append(' ').append(attr).append("=\"")
      .append(ATTR.escape(value)).append('"');
  }

  /** Writes a root attribute on its own line, starting at {@code column}. */
  void rootAttr (int column, String attr, String value) {
    _out.append('\n');
    for (int ii = 0; ii < column; ii++) _out.append(' ');
    _out.append(attr).append("=\"").append(ATTR.escape(value)).append('"');
  }

  /** Terminates the root start tag. */
  void rootEnd () {
    _out.append(">\n");
  }

  /** Appends {@code text} as is. */
  void raw (String text) {
    _out.append(text);
  }

  private StringBuilder indent (int level) {
    StringBuilder out = _out;
    for (int ii = 0, ll = level*2; ii < ll; ii++) out.append(' ');
    return out;
  }

  private static final Escaper ATTR = XmlEscapers.xmlAttributeEscaper();
  private static final Escaper TEXT = XmlEscapers.xmlContentEscaper();

  private final StringBuilder _out;
}
