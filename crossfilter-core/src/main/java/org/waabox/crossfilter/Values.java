package org.waabox.crossfilter;

import java.util.Objects;

/**
 * Helpers for the numeric values held in filterable columns.
 *
 * <p>Every value is stored as a {@code double} so that {@code 1},
 * {@code 1L} and {@code 1.0} land in the same index bucket.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Values {

  /** Utility class. */
  private Values() {
  }

  /**
   * Converts a number to its canonical filter value.
   *
   * <p>Negative zero is folded into zero, as both compare equal as
   * numbers but not as boxed doubles.
   *
   * @param number the number to convert, never null
   *
   * @return the canonical value
   */
  public static double normalize(final Number number) {
    Objects.requireNonNull(number, "number must not be null");
    final double value = number.doubleValue();
    return value == 0.0d ? 0.0d : value;
  }

  /**
   * Formats a value the way it is shown in an option list.
   *
   * <p>Integral values print without a fractional part.
   *
   * @param value the value to format
   *
   * @return the display text, never null
   */
  public static String format(final double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)
        && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }
}
