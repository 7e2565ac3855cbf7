//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import java.util.ArrayList;
import java.util.List;

/** An {@code anyxml} node. */
public final class AnyxmlNode extends Node {

  public When when;
  public final List<Restriction> musts = new ArrayList<>();

  public AnyxmlNode (Module module, String name) {
    super(Kind.ANYXML, module, name);
  }
}
