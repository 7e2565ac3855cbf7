//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;

/**
 * A {@code deviation} of a node defined in another module.
 */
public final class Deviation {

  /** The kinds of deviate edit. */
  public enum Op {
    NOT_SUPPORTED("not-supported"),
    ADD("add"),
    REPLACE("replace"),
    DELETE("delete");

    /** The argument of the {@code deviate} statement. */
    public final String keyword;

    Op (String keyword) {
      this.keyword = keyword;
    }
  }

  /** One {@code deviate} entry. Only the fields that are set are printed. */
  public static final class Deviate {
    public final Op op;

    public Boolean config;
    public Boolean mandatory;
    public String dflt;

    /** The {@code min-elements} value, or null if not set. */
    public Integer minElements;

    /** The {@code max-elements} value, or null if not set. Zero means unbounded. */
    public Integer maxElements;

    public final List<Restriction> musts = new ArrayList<>();
    public final List<Unique> uniques = new ArrayList<>();
    public Type type;
    public String units;

    public Deviate (Op op) {
      this.op = Preconditions.checkNotNull(op, "op");
    }
  }

  /** The absolute schema node path of the deviated node, in canonical form. */
  public final String targetPath;

  public String description;
  public String reference;

  public final List<Deviate> deviates = new ArrayList<>();

  public Deviation (String targetPath) {
    this.targetPath = Preconditions.checkNotNull(targetPath, "targetPath");
  }

  /** Adds a deviate entry of kind {@code op} and returns it. */
  public Deviate add (Op op) {
    Deviate dev = new Deviate(op);
    deviates.add(dev);
    return dev;
  }
}
