//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

/**
 * The YANG built-in types. Every {@link Type} ultimately resolves to one of these.
 */
public enum BaseType {

  BINARY("binary"),
  BITS("bits"),
  BOOLEAN("boolean"),
  DECIMAL64("decimal64"),
  EMPTY("empty"),
  ENUMERATION("enumeration"),
  IDENTITYREF("identityref"),
  INSTANCE_IDENTIFIER("instance-identifier"),
  INT8("int8"),
  INT16("int16"),
  INT32("int32"),
  INT64("int64"),
  UINT8("uint8"),
  UINT16("uint16"),
  UINT32("uint32"),
  UINT64("uint64"),
  LEAFREF("leafref"),
  STRING("string"),
  UNION("union");

  /** The name of the built-in type in YANG source. */
  public final String keyword;

  /** Returns true for the eight integer types. */
  public boolean isInteger () {
    switch (this) {
    case INT8: case INT16: case INT32: case INT64:
    case UINT8: case UINT16: case UINT32: case UINT64:
      return true;
    default:
      return false;
    }
  }

  BaseType (String keyword) {
    this.keyword = keyword;
  }
}
