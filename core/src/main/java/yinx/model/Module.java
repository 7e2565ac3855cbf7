//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A YANG module or submodule. A submodule {@link #belongsTo} a module, shares its namespace and
 * has no namespace of its own.
 *
 * <p>The definition lists are public and mutable so that a model can be assembled piecemeal; a
 * module must not be changed once it has been handed to a printer.</p>
 */
public final class Module {

  /** Creates a module named {@code name} with namespace {@code namespace} and prefix
    * {@code prefix}. */
  public static Module module (String name, String namespace, String prefix) {
    return new Module(name, null, Preconditions.checkNotNull(namespace, "namespace"), prefix);
  }

  /** Creates a submodule named {@code name} belonging to {@code belongsTo}.
    * @param prefix the prefix by which the submodule refers to {@code belongsTo}. */
  public static Module submodule (String name, Module belongsTo, String prefix) {
    Preconditions.checkArgument(!belongsTo.isSubmodule(),
                                "%s cannot belong to submodule %s", name, belongsTo.name);
    return new Module(name, belongsTo, null, prefix);
  }

  public final String name;

  /** The module to which this submodule belongs, or null if this is a module. */
  public final Module belongsTo;

  /** The namespace URI. Null for a submodule. */
  public final String namespace;

  /** The module's prefix, or for a submodule, the prefix of its {@code belongs-to}. */
  public final String prefix;

  /** The declared YANG version, or null if not declared. */
  public YangVersion version;

  public String organization;
  public String contact;
  public String description;
  public String reference;

  /** Whether other modules deviate nodes of this module. */
  public boolean deviated;

  public final List<Revision> revisions = new ArrayList<>();
  public final List<Import> imports = new ArrayList<>();
  public final List<Include> includes = new ArrayList<>();
  public final List<Feature> features = new ArrayList<>();
  public final List<Identity> identities = new ArrayList<>();
  public final List<Typedef> typedefs = new ArrayList<>();
  public final List<Deviation> deviations = new ArrayList<>();
  public final List<Augment> augments = new ArrayList<>();

  /** Returns true if this is a submodule. */
  public boolean isSubmodule () {
    return belongsTo != null;
  }

  /** Returns the module that owns this unit's namespace: {@link #belongsTo} for a submodule, this
    * module otherwise. */
  public Module mainModule () {
    return (belongsTo == null) ? this : belongsTo;
  }

  /** Returns the top-level data nodes (including rpcs and notifications), in schema order. This
    * includes nodes contributed by submodules. */
  public List<Node> data () {
    return Collections.unmodifiableList(_data);
  }

  /** Adds {@code node} as the last top-level node and returns it. */
  public <N extends Node> N add (N node) {
    Preconditions.checkState(node.parent() == null, "%s is not a top-level node", node);
    _data.add(node);
    return node;
  }

  /** Adds an import of {@code module} under {@code prefix} and returns it. */
  public Import addImport (Module module, String prefix) {
    Import imp = new Import(module, prefix);
    imports.add(imp);
    return imp;
  }

  /** Adds an include of {@code submodule} and returns it. */
  public Include addInclude (Module submodule) {
    Preconditions.checkArgument(submodule.belongsTo == mainModule(),
                                "%s does not belong to %s", submodule.name, mainModule().name);
    Include inc = new Include(submodule);
    includes.add(inc);
    return inc;
  }

  /** Returns the prefix under which this unit's own imports refer to {@code moduleName}. Imports
    * of included submodules are not consulted. */
  public Optional<String> importPrefix (String moduleName) {
    for (Import imp : imports) {
      if (imp.module.name.equals(moduleName)) return Optional.of(imp.prefix);
    }
    return Optional.empty();
  }

  /** Returns the prefix by which this unit can refer to {@code moduleName}: its own prefix if it
    * is that module, else the prefix of one of its imports, else the prefix of an import made by
    * one of its included submodules (first match in include order). */
  public Optional<String> prefixFor (String moduleName) {
    if (name.equals(moduleName)) return Optional.of(prefix);
    Optional<String> pre = importPrefix(moduleName);
    if (pre.isPresent()) return pre;
    for (Include inc : includes) {
      pre = inc.submodule.importPrefix(moduleName);
      if (pre.isPresent()) return pre;
    }
    return Optional.empty();
  }

  /** Returns the module visible from this unit under the name {@code moduleName}: its main module
    * or one of its imports. */
  public Optional<Module> visibleModule (String moduleName) {
    Module main = mainModule();
    if (main.name.equals(moduleName)) return Optional.of(main);
    for (Import imp : imports) {
      if (imp.module.name.equals(moduleName)) return Optional.of(imp.module);
    }
    return Optional.empty();
  }

  @Override public String toString () {
    return (isSubmodule() ? "submodule " : "module ") + name;
  }

  private Module (String name, Module belongsTo, String namespace, String prefix) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.belongsTo = belongsTo;
    this.namespace = namespace;
    this.prefix = Preconditions.checkNotNull(prefix, "prefix");
  }

  private final List<Node> _data = new ArrayList<>();
}
