package org.waabox.crossfilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finds the filterable columns of a dataset.
 *
 * <p>By convention every numeric field except the identifier is
 * filterable. The first row is taken as representative of the whole feed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ColumnDiscovery {

  /** Utility class. */
  private ColumnDiscovery() {
  }

  /**
   * Returns the numeric field names of the first row, excluding the
   * identifier field, in field order.
   *
   * @param rows    the dataset rows, never null
   * @param idField the identifier field name, never null
   *
   * @return an unmodifiable list of column names, empty if there are no
   *         rows, never null
   */
  public static List<String> numericColumns(final List<Row> rows,
      final String idField) {
    Objects.requireNonNull(rows, "rows must not be null");
    Objects.requireNonNull(idField, "idField must not be null");
    if (rows.isEmpty()) {
      return Collections.emptyList();
    }
    final List<String> columns = new ArrayList<>();
    for (final Map.Entry<String, Object> field
        : rows.get(0).fields().entrySet()) {
      if (!field.getKey().equals(idField)
          && field.getValue() instanceof Number) {
        columns.add(field.getKey());
      }
    }
    return Collections.unmodifiableList(columns);
  }
}
