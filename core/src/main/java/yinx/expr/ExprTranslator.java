//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.expr;

import yinx.model.Module;

/**
 * Translates expressions stored in canonical form, where names are qualified by the name of their
 * defining module ({@code ietf-interfaces:interfaces/interface}), into the prefix-qualified form
 * used in a module's source text ({@code if:interfaces/interface}).
 */
public interface ExprTranslator {

  /**
   * Translates an XPath expression ({@code when}, {@code must}, leafref {@code path}) so that each
   * qualifier is the prefix under which {@code module} refers to the qualifying module.
   * @throws TranslateException if a qualifier names a module that {@code module} cannot see.
   */
  String toSchema (Module module, String expr) throws TranslateException;

  /**
   * Translates a schema node path (the target of an {@code augment}, {@code refine} or
   * {@code deviation}) so that each qualifier is the qualifying module's own prefix.
   * @throws TranslateException if a qualifier names a module that {@code module} cannot see.
   */
  String toXmlPath (Module module, String path) throws TranslateException;
}
