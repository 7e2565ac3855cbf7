//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

/**
 * The default-deny extensions defined by the NETCONF access control model. A node carrying one of
 * these restricts access to itself and everything beneath it.
 */
public enum NacmDefault {

  DENY_WRITE("default-deny-write"),
  DENY_ALL("default-deny-all");

  /** The name of the module that defines these extensions. */
  public static final String MODULE = "ietf-netconf-acm";

  /** The extension keyword, used as the (unprefixed) element name. */
  public final String keyword;

  NacmDefault (String keyword) {
    this.keyword = keyword;
  }
}
