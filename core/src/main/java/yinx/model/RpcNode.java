//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import java.util.ArrayList;
import java.util.List;

/** An {@code rpc}. Its children are its input, output and groupings. */
public final class RpcNode extends Node {

  public final List<Typedef> typedefs = new ArrayList<>();

  public RpcNode (Module module, String name) {
    super(Kind.RPC, module, name);
  }
}
