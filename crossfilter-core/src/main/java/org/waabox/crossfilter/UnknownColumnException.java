package org.waabox.crossfilter;

import java.util.Objects;

/**
 * Thrown when a query or a filter mutation references a column that is not
 * part of the active index.
 *
 * <p>Columns are fixed when the index is built; a name outside that set is
 * rejected rather than treated as an unconstrained column.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UnknownColumnException extends CrossFilterException {

  private static final long serialVersionUID = 1L;

  /** The rejected column name. */
  private final String column;

  /**
   * Creates a new exception for the given column.
   *
   * @param column the name of the missing column, cannot be null.
   */
  public UnknownColumnException(final String column) {
    super("Column '" + Objects.requireNonNull(column, "column")
        + "' is not indexed");
    this.column = column;
  }

  /**
   * Returns the rejected column name.
   *
   * @return the column name, never null
   */
  public String column() {
    return column;
  }
}
