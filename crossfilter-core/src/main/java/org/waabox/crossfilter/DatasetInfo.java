package org.waabox.crossfilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes the shape of a dataset feed: how many rows, and which fields
 * the rows carry.
 *
 * @param rowCount    the number of rows
 * @param columnCount the number of fields, identifier included
 * @param columns     the field names of the first row, never null,
 *                    unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DatasetInfo(int rowCount, int columnCount,
    List<String> columns) {

  /**
   * Creates a new DatasetInfo instance.
   *
   * @param rowCount    the number of rows
   * @param columnCount the number of fields
   * @param columns     the field names, never null
   *
   * @throws NullPointerException if columns is null
   */
  public DatasetInfo {
    Objects.requireNonNull(columns, "columns must not be null");
    columns = Collections.unmodifiableList(List.copyOf(columns));
  }

  /**
   * Describes the given rows. The first row defines the fields.
   *
   * @param rows the dataset rows, never null
   *
   * @return the dataset info, never null
   */
  public static DatasetInfo of(final List<Row> rows) {
    Objects.requireNonNull(rows, "rows must not be null");
    if (rows.isEmpty()) {
      return new DatasetInfo(0, 0, Collections.emptyList());
    }
    final List<String> columns = new ArrayList<>(
        rows.get(0).fields().keySet());
    return new DatasetInfo(rows.size(), columns.size(), columns);
  }
}
