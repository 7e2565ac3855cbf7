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
 * A node in the schema tree. The set of node kinds is closed: every subclass lives in this package
 * and is identified by its {@link Kind}.
 *
 * <p>A node's {@link #module} is normally the module of its parent. The exception is a node that
 * another (sub)module injected via {@code augment}: it hangs under its structural parent like any
 * other child, but belongs to the augmenting module.</p>
 */
public abstract class Node extends Documented {

  /** Enumerates the kinds of schema node. */
  public enum Kind {
    CONTAINER("container"),
    CHOICE("choice"),
    CASE("case"),
    LEAF("leaf"),
    LEAF_LIST("leaf-list"),
    LIST("list"),
    USES("uses"),
    GROUPING("grouping"),
    ANYXML("anyxml"),
    INPUT("input"),
    OUTPUT("output"),
    RPC("rpc"),
    NOTIFICATION("notification");

    /** The YANG keyword (and YIN element name) for this kind. */
    public final String keyword;

    Kind (String keyword) {
      this.keyword = keyword;
    }
  }

  /** The kind of this node. */
  public final Kind kind;

  /** The module (or submodule) that defines this node. */
  public final Module module;

  /** The name of this node. */
  public final String name;

  /** The explicitly declared {@code config} value, or null if inherited. */
  public Boolean config;

  /** The explicitly declared {@code mandatory} value, or null if not declared. */
  public Boolean mandatory;

  /** The NACM default-deny markers declared directly on this node. */
  public final Set<NacmDefault> nacm = EnumSet.noneOf(NacmDefault.class);

  /** The features on which this node is conditional. */
  public final List<Feature> ifFeatures = new ArrayList<>();

  /** Returns the parent of this node, or null for a top-level node. */
  public Node parent () {
    return _parent;
  }

  /** Returns the augment that injected this node, or null if it was declared in place. */
  public Augment augment () {
    return _augment;
  }

  /** Returns the children of this node, in schema order. */
  public List<Node> children () {
    return Collections.unmodifiableList(_children);
  }

  /** Adds {@code child} as the last child of this node and returns it. */
  public <N extends Node> N add (N child) {
    Preconditions.checkArgument(child != this, "Cannot add %s to itself", this);
    Preconditions.checkState(child._parent == null, "%s already has parent %s", child,
                             child._parent);
    child._parent = this;
    _children.add(child);
    return child;
  }

  /** Returns the config value in effect for this node: the declared value, else the parent's
    * effective value, else true. */
  public boolean effectiveConfig () {
    if (config != null) return config;
    return (_parent == null) ? true : _parent.effectiveConfig();
  }

  /** Returns the NACM markers in effect for this node: its own plus those of its ancestors and of
    * any augment that injected it or one of its ancestors. */
  public Set<NacmDefault> effectiveNacm () {
    Set<NacmDefault> eff = EnumSet.noneOf(NacmDefault.class);
    for (Node node = this; node != null; node = node._parent) {
      eff.addAll(node.nacm);
      if (node._augment != null) eff.addAll(node._augment.nacm);
    }
    return eff;
  }

  /** Returns the NACM markers that this node adds to those in effect for its parent (and for the
    * augment that injected it, if any). */
  public Set<NacmDefault> introducedNacm () {
    Set<NacmDefault> intro = EnumSet.noneOf(NacmDefault.class);
    intro.addAll(nacm);
    if (_parent != null) intro.removeAll(_parent.effectiveNacm());
    if (_augment != null) intro.removeAll(_augment.nacm);
    return intro;
  }

  @Override public String toString () {
    return kind.keyword + " '" + name + "'";
  }

  Node (Kind kind, Module module, String name) {
    this.kind = kind;
    this.module = Preconditions.checkNotNull(module, "module");
    this.name = Preconditions.checkNotNull(name, "name");
  }

  /** Records that {@code augment} injected this node. */
  void injectedBy (Augment augment) {
    Preconditions.checkState(_augment == null, "%s already injected by %s", this, _augment);
    _augment = augment;
  }

  Node _parent;
  private Augment _augment;
  private final List<Node> _children = new ArrayList<>();
}
