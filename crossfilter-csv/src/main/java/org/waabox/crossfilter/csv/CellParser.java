package org.waabox.crossfilter.csv;

import java.util.regex.Pattern;

/**
 * Turns raw CSV cells into typed values.
 *
 * <p>Integers become {@link Long} (or {@link Double} when they overflow),
 * decimals and exponent forms become {@link Double}, {@code true} and
 * {@code false} become {@link Boolean}, and anything else stays a
 * {@link String}. Blank cells have no value.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class CellParser {

  /** Optional sign followed by digits only. */
  private static final Pattern INTEGER = Pattern.compile("-?\\d+");

  /** Decimal number, optionally with an exponent. */
  private static final Pattern DECIMAL = Pattern.compile(
      "-?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

  /** Utility class. */
  private CellParser() {
  }

  /**
   * Parses a cell.
   *
   * @param cell the raw cell text, may be null
   *
   * @return the typed value, or null for a missing or blank cell
   */
  static Object parse(final String cell) {
    if (cell == null) {
      return null;
    }
    final String text = cell.trim();
    if (text.isEmpty()) {
      return null;
    }
    if (INTEGER.matcher(text).matches()) {
      try {
        return Long.parseLong(text);
      } catch (final NumberFormatException e) {
        return Double.parseDouble(text);
      }
    }
    if (DECIMAL.matcher(text).matches()) {
      return Double.parseDouble(text);
    }
    if ("true".equalsIgnoreCase(text)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(text)) {
      return Boolean.FALSE;
    }
    return text;
  }
}
