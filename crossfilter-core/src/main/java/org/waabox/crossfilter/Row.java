package org.waabox.crossfilter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single record of the dataset: a unique identifier plus its named
 * fields.
 *
 * <p>Fields keep the order the feed produced them in. Only numeric fields
 * can take part in filtering; other fields travel with the row untouched.
 *
 * @param id     the unique row identifier
 * @param fields the row fields by name, never null, unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Row(long id, Map<String, Object> fields) {

  /** The largest magnitude a double holds without losing integer digits. */
  private static final double MAX_EXACT_IDENTIFIER = 9007199254740992d;

  /**
   * Creates a new Row.
   *
   * @param id     the unique row identifier
   * @param fields the row fields by name, never null
   *
   * @throws NullPointerException if fields is null
   */
  public Row {
    Objects.requireNonNull(fields, "fields must not be null");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Creates a row from a field mapping, reading the identifier from the
   * given identifier field.
   *
   * @param fields  the row fields, never null
   * @param idField the name of the identifier field, never null
   *
   * @return the new row, never null
   *
   * @throws IllegalArgumentException if the identifier field is missing or
   *                                  is not an integral number
   */
  public static Row of(final Map<String, Object> fields,
      final String idField) {
    Objects.requireNonNull(fields, "fields must not be null");
    Objects.requireNonNull(idField, "idField must not be null");
    final Object id = fields.get(idField);
    if (!isIdentifier(id)) {
      throw new IllegalArgumentException("Field '" + idField
          + "' must hold an integral identifier, found: " + id);
    }
    return new Row(((Number) id).longValue(), fields);
  }

  /**
   * Returns whether a value can serve as a row identifier without losing
   * information when converted to {@code long}.
   *
   * @param value the candidate value, may be null
   *
   * @return true for integral numbers, including integral doubles within
   *         the exactly representable range
   */
  public static boolean isIdentifier(final Object value) {
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return true;
    }
    if (value instanceof Number number) {
      final double candidate = number.doubleValue();
      return candidate == Math.rint(candidate)
          && Math.abs(candidate) <= MAX_EXACT_IDENTIFIER;
    }
    return false;
  }

  /**
   * Returns the raw value of a field.
   *
   * @param field the field name, never null
   *
   * @return the value, or null if the row has no such field
   */
  public Object value(final String field) {
    Objects.requireNonNull(field, "field must not be null");
    return fields.get(field);
  }

  /**
   * Returns the normalized numeric value of a column.
   *
   * @param column the column name, never null
   *
   * @return the value as normalized by {@link Values#normalize(Number)}
   *
   * @throws MalformedRowException if the column is missing or not numeric
   */
  public double number(final String column) {
    final Object value = value(column);
    if (value instanceof Number number) {
      return Values.normalize(number);
    }
    throw new MalformedRowException(id, column, value);
  }

  /**
   * Returns whether the given field holds a number in this row.
   *
   * @param field the field name, never null
   *
   * @return true if the field is present and numeric
   */
  public boolean isNumeric(final String field) {
    return value(field) instanceof Number;
  }
}
