//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * An {@code augment}: a set of nodes that {@link #module} injects under a target node. When the
 * target is known, each added node is also attached to the target as a child, so it appears in
 * the target's children while still belonging to {@link #module}. Either way the node records
 * this augment as its {@link Node#augment}.
 */
public final class Augment extends Documented {

  /** The module (or submodule) that declares this augment. */
  public final Module module;

  /** The schema node path of the target, in canonical form. */
  public final String targetPath;

  /** The resolved target node, or null if it is not part of the model. */
  public final Node target;

  /** The NACM default-deny markers declared on this augment. */
  public final Set<NacmDefault> nacm = EnumSet.noneOf(NacmDefault.class);

  public final List<Feature> ifFeatures = new ArrayList<>();
  public When when;

  public Augment (Module module, String targetPath, Node target) {
    this.module = Preconditions.checkNotNull(module, "module");
    this.targetPath = Preconditions.checkNotNull(targetPath, "targetPath");
    this.target = target;
  }

  /** Returns the nodes this augment injects, in declared order. */
  public List<Node> children () {
    return Collections.unmodifiableList(_children);
  }

  /** Adds {@code child} to this augment (and to the target, if known) and returns it. */
  public <N extends Node> N add (N child) {
    Preconditions.checkArgument(child.module == module, "%s does not belong to %s", child,
                                module.name);
    if (target != null) target.add(child);
    child.injectedBy(this);
    _children.add(child);
    return child;
  }

  @Override public String toString () {
    return "Augment(" + targetPath + ")";
  }

  private final List<Node> _children = new ArrayList<>();
}
