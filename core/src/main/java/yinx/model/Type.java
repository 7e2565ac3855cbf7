//
// Yinx - renders YANG schema models as YIN
// See LICENSE in the project root for terms

package yinx.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * The type of a leaf, leaf-list or typedef. A type is tagged with its {@link BaseType} and the
 * concrete subclass carries only the restrictions that are meaningful for that base type. A type
 * is either an in-line built-in type or is {@link #derived} from a named typedef.
 */
public abstract class Type {

  /** The {@code boolean} and {@code empty} types, which accept no restrictions. */
  public static final class Simple extends Type {
    public Simple (BaseType base) {
      super(base);
      Preconditions.checkArgument(base == BaseType.BOOLEAN || base == BaseType.EMPTY,
                                  "%s is not a simple type", base);
    }
  }

  /** One of the integer types. */
  public static final class Numeric extends Type {
    /** The {@code range} restriction, or null. */
    public Restriction range;

    public Numeric (BaseType base) {
      super(base);
      Preconditions.checkArgument(base.isInteger(), "%s is not an integer type", base);
    }
  }

  /** The {@code string} type. */
  public static final class StringType extends Type {
    /** The {@code length} restriction, or null. */
    public Restriction length;
    /** The {@code pattern} restrictions, in declared order. */
    public final List<Restriction> patterns = new ArrayList<>();

    public StringType () {
      super(BaseType.STRING);
    }
  }

  /** The {@code binary} type. */
  public static final class Binary extends Type {
    /** The {@code length} restriction, or null. */
    public Restriction length;

    public Binary () {
      super(BaseType.BINARY);
    }
  }

  /** The {@code decimal64} type. */
  public static final class Decimal64 extends Type {
    /** The number of fraction digits, 1 to 18. */
    public final int fractionDigits;
    /** The {@code range} restriction, or null. */
    public Restriction range;

    public Decimal64 (int fractionDigits) {
      super(BaseType.DECIMAL64);
      Preconditions.checkArgument(fractionDigits >= 1 && fractionDigits <= 18,
                                  "fraction-digits must be in 1..18: %s", fractionDigits);
      this.fractionDigits = fractionDigits;
    }
  }

  /** A member of an enumeration. */
  public static final class EnumValue extends Documented {
    public final String name;
    /** The assigned value. Always printed, whether declared or auto-assigned. */
    public final int value;

    public EnumValue (String name, int value) {
      this.name = Preconditions.checkNotNull(name, "name");
      this.value = value;
    }
  }

  /** The {@code enumeration} type. */
  public static final class Enumeration extends Type {
    public final List<EnumValue> enums = new ArrayList<>();

    public Enumeration () {
      super(BaseType.ENUMERATION);
    }

    /** Adds a member named {@code name} with value {@code value} and returns it. */
    public EnumValue add (String name, int value) {
      EnumValue enm = new EnumValue(name, value);
      enums.add(enm);
      return enm;
    }
  }

  /** A member of a bits type. */
  public static final class Bit extends Documented {
    public final String name;
    /** The assigned position. Always printed, whether declared or auto-assigned. */
    public final long position;

    public Bit (String name, long position) {
      Preconditions.checkArgument(position >= 0 && position <= 0xFFFFFFFFL,
                                  "bit position out of range: %s", position);
      this.name = Preconditions.checkNotNull(name, "name");
      this.position = position;
    }
  }

  /** The {@code bits} type. */
  public static final class Bits extends Type {
    public final List<Bit> bits = new ArrayList<>();

    public Bits () {
      super(BaseType.BITS);
    }

    /** Adds a bit named {@code name} at {@code position} and returns it. */
    public Bit add (String name, long position) {
      Bit bit = new Bit(name, position);
      bits.add(bit);
      return bit;
    }
  }

  /** The {@code identityref} type. */
  public static final class IdentityRef extends Type {
    /** The identity from which referenced identities must derive. */
    public final Identity base;

    public IdentityRef (Identity base) {
      super(BaseType.IDENTITYREF);
      this.base = Preconditions.checkNotNull(base, "base");
    }
  }

  /** The {@code leafref} type. */
  public static final class LeafRef extends Type {
    /** The target path, in canonical (module name qualified) form. */
    public final String path;

    public LeafRef (String path) {
      super(BaseType.LEAFREF);
      this.path = Preconditions.checkNotNull(path, "path");
    }
  }

  /** The {@code instance-identifier} type. */
  public static final class InstanceId extends Type {
    /** The explicit {@code require-instance} setting, or null if not declared. */
    public Boolean requireInstance;

    public InstanceId () {
      super(BaseType.INSTANCE_IDENTIFIER);
    }
  }

  /** The {@code union} type. */
  public static final class Union extends Type {
    /** The member types, in declared order. */
    public final List<Type> types;

    public Union (Type... types) {
      super(BaseType.UNION);
      Preconditions.checkArgument(types.length > 0, "union requires at least one member type");
      this.types = ImmutableList.copyOf(types);
    }
  }

  /** The built-in type that this type resolves to. */
  public final BaseType base;

  /** The typedef from which this type is derived, or null for an in-line built-in type. */
  public Typedef derived;

  /** Marks this type as derived from {@code typedef}. */
  public Type derivedFrom (Typedef typedef) {
    Preconditions.checkArgument(typedef.type.base == base, "Typedef %s is a %s, not a %s",
                                typedef.name, typedef.type.base, base);
    this.derived = typedef;
    return this;
  }

  /** Returns the unqualified name of this type: the typedef name or the built-in keyword. */
  public String name () {
    return (derived == null) ? base.keyword : derived.name;
  }

  @Override public String toString () {
    return getClass().getSimpleName() + "(" + name() + ")";
  }

  private Type (BaseType base) {
    this.base = base;
  }
}
