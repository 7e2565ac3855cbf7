//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@code refine} of a node instantiated by a {@code uses}. Which of the kind-specific overrides
 * apply depends on {@link #targetKind}: {@link #dflt} for leaves and choices, {@link #presence}
 * for containers, {@link #minElements} and {@link #maxElements} for lists and leaf-lists.
 */
public final class Refine extends Documented {

  /** The descendant schema node path of the target, in canonical form. */
  public final String targetPath;

  /** The kind of the refined node. */
  public final Node.Kind targetKind;

  public Boolean config;
  public Boolean mandatory;
  public final List<Restriction> musts = new ArrayList<>();
  public String dflt;
  public String presence;

  /** The refined {@code min-elements}, or null if not refined. */
  public Integer minElements;

  /** The refined {@code max-elements}, or null if not refined. Zero means unbounded. */
  public Integer maxElements;

  public Refine (String targetPath, Node.Kind targetKind) {
    this.targetPath = Preconditions.checkNotNull(targetPath, "targetPath");
    this.targetKind = Preconditions.checkNotNull(targetKind, "targetKind");
  }
}
