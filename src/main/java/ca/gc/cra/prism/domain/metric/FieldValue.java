package ca.gc.cra.prism.domain.metric;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Typed value of a single metric field.
 * <p><strong>Why:</strong> Producers emit integers, unsigned integers, floats, text, and booleans; only the numeric
 * variants become samples, so the numeric/non-numeric split is explicit in the type.</p>
 * <p><strong>Role:</strong> Domain tagged union carried by {@link MetricRecord#fields()}.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface FieldValue
    permits FieldValue.Int64, FieldValue.UInt64, FieldValue.Float64, FieldValue.Text, FieldValue.Bool {

  /**
   * Indicates whether this value can be shipped as a sample.
   *
   * @return {@code true} for {@link Int64}, {@link UInt64}, and {@link Float64}
   */
  boolean isNumeric();

  /**
   * Converts numeric variants to a 64-bit float.
   *
   * @return the converted value, or empty for non-numeric variants
   */
  OptionalDouble asDouble();

  static FieldValue of(long value) {
    return new Int64(value);
  }

  static FieldValue ofUnsigned(long bits) {
    return new UInt64(bits);
  }

  static FieldValue of(double value) {
    return new Float64(value);
  }

  static FieldValue of(String value) {
    return new Text(value);
  }

  static FieldValue of(boolean value) {
    return new Bool(value);
  }

  /** Signed 64-bit integer. */
  record Int64(long value) implements FieldValue {
    @Override
    public boolean isNumeric() {
      return true;
    }

    @Override
    public OptionalDouble asDouble() {
      return OptionalDouble.of((double) value);
    }
  }

  /**
   * Unsigned 64-bit integer held in the bits of a {@code long}.
   *
   * @param bits raw two's-complement bits interpreted as unsigned
   */
  record UInt64(long bits) implements FieldValue {
    @Override
    public boolean isNumeric() {
      return true;
    }

    @Override
    public OptionalDouble asDouble() {
      if (bits >= 0) {
        return OptionalDouble.of((double) bits);
      }
      // top bit set: halve, convert, double, and restore the dropped low bit
      double half = (double) ((bits >>> 1) | (bits & 1L));
      return OptionalDouble.of(half * 2.0d);
    }

    @Override
    public String toString() {
      return "UInt64[" + Long.toUnsignedString(bits) + "]";
    }
  }

  /** IEEE-754 double. */
  record Float64(double value) implements FieldValue {
    @Override
    public boolean isNumeric() {
      return true;
    }

    @Override
    public OptionalDouble asDouble() {
      return OptionalDouble.of(value);
    }
  }

  /** Free-form text; never shipped. */
  record Text(String value) implements FieldValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isNumeric() {
      return false;
    }

    @Override
    public OptionalDouble asDouble() {
      return OptionalDouble.empty();
    }
  }

  /** Boolean flag; never shipped. */
  record Bool(boolean value) implements FieldValue {
    @Override
    public boolean isNumeric() {
      return false;
    }

    @Override
    public OptionalDouble asDouble() {
      return OptionalDouble.empty();
    }
  }
}
