//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import java.util.ArrayList;
import java.util.List;

/** A {@code container} node. */
public final class ContainerNode extends Node {

  public When when;
  public final List<Restriction> musts = new ArrayList<>();

  /** The {@code presence} meaning, or null for a non-presence container. */
  public String presence;

  public final List<Typedef> typedefs = new ArrayList<>();

  public ContainerNode (Module module, String name) {
    super(Kind.CONTAINER, module, name);
  }
}
