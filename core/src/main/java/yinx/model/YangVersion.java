//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

/**
 * The YANG language versions a module may declare.
 */
public enum YangVersion {

  V1("1"),
  V1_1("1.1");

  /** The argument of the {@code yang-version} statement. */
  public final String keyword;

  YangVersion (String keyword) {
    this.keyword = keyword;
  }
}
