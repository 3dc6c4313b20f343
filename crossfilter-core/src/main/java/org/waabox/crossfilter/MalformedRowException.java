package org.waabox.crossfilter;

/**
 * Thrown when a row lacks a requested column or holds a non-numeric value
 * in it.
 *
 * <p>The row feed is expected to be well formed. This exception only makes
 * the failure explicit, it fails the build that hit it.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MalformedRowException extends CrossFilterException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param rowId  the identifier of the offending row
   * @param column the column that could not be read, never null
   * @param value  the value found, may be null
   */
  public MalformedRowException(final long rowId, final String column,
      final Object value) {
    super("Row " + rowId + " has no numeric value for column '" + column
        + "', found: " + value);
  }
}
