//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.expr;

import java.util.Optional;
import yinx.model.Module;

/**
 * The default {@link ExprTranslator}. Scans an expression for qualified names and rewrites each
 * module name qualifier to a prefix. Quoted literals, unqualified names and XPath axis separators
 * ({@code child::x}) are copied verbatim.
 */
public class ModuleNameTranslator implements ExprTranslator {

  @Override public String toSchema (Module module, String expr) throws TranslateException {
    return translate(module, expr, false);
  }

  @Override public String toXmlPath (Module module, String path) throws TranslateException {
    return translate(module, path, true);
  }

  /** Returns the prefix to substitute for {@code moduleName}. */
  protected String prefix (Module module, String moduleName, boolean ownPrefix)
      throws TranslateException {
    Module main = module.mainModule();
    if (main.name.equals(moduleName)) return ownPrefix ? main.prefix : module.prefix;
    if (ownPrefix) {
      Optional<Module> target = module.visibleModule(moduleName);
      if (target.isPresent()) return target.get().prefix;
    } else {
      Optional<String> prefix = module.importPrefix(moduleName);
      if (prefix.isPresent()) return prefix.get();
    }
    throw new TranslateException("Module '" + moduleName + "' is not imported by '" +
                                 module.name + "'");
  }

  private String translate (Module module, String expr, boolean ownPrefix)
      throws TranslateException {
    StringBuilder sb = new StringBuilder(expr.length());
    int ii = 0, ll = expr.length();
    while (ii < ll) {
      char c = expr.charAt(ii);
      if (c == '\'' || c == '"') {
        int end = expr.indexOf(c, ii+1);
        if (end == -1) throw new TranslateException(
          "Unterminated literal at " + ii + " in '" + expr + "'");
        sb.append(expr, ii, end+1);
        ii = end+1;

      } else if (isNameStart(c)) {
        int end = ii+1;
        while (end < ll && isNameChar(expr.charAt(end))) end++;
        String name = expr.substring(ii, end);
        boolean qualifier = end < ll && expr.charAt(end) == ':' &&
          (end+1 == ll || expr.charAt(end+1) != ':');
        if (qualifier) {
          sb.append(prefix(module, name, ownPrefix)).append(':');
          ii = end+1;
        } else {
          sb.append(name);
          ii = end;
        }

      } else if (c == ':' && ii+1 < ll && expr.charAt(ii+1) == ':') {
        sb.append("::");
        ii += 2;

      } else {
        sb.append(c);
        ii++;
      }
    }
    return sb.toString();
  }

  private static boolean isNameStart (char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isNameChar (char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
  }
}
