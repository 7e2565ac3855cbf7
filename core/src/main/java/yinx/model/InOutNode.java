//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/** The {@code input} or {@code output} of an rpc. */
public final class InOutNode extends Node {

  public final List<Typedef> typedefs = new ArrayList<>();

  /** Creates the input of an rpc. */
  public static InOutNode input (Module module) {
    return new InOutNode(Kind.INPUT, module);
  }

  /** Creates the output of an rpc. */
  public static InOutNode output (Module module) {
    return new InOutNode(Kind.OUTPUT, module);
  }

  private InOutNode (Kind kind, Module module) {
    super(kind, module, kind.keyword);
    Preconditions.checkArgument(kind == Kind.INPUT || kind == Kind.OUTPUT);
  }
}
