//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import java.util.ArrayList;
import java.util.List;

/** A {@code notification}. */
public final class NotificationNode extends Node {

  public final List<Typedef> typedefs = new ArrayList<>();

  public NotificationNode (Module module, String name) {
    super(Kind.NOTIFICATION, module, name);
  }
}
