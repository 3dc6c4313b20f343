package org.waabox.crossfilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test fixtures: small datasets of numbered rows.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class Rows {

  private Rows() {
  }

  /**
   * Creates a row from alternating field names and values.
   *
   * @param id        the row identifier
   * @param keyValues field name, value, field name, value...
   *
   * @return the row, never null
   */
  static Row row(final long id, final Object... keyValues) {
    final Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("id", id);
    for (int i = 0; i < keyValues.length; i += 2) {
      fields.put((String) keyValues[i], keyValues[i + 1]);
    }
    return new Row(id, fields);
  }

  /**
   * Creates rows 1..count, each with a {@code number} column holding its
   * id and a {@code mod3} column holding id modulo 3.
   *
   * @param count how many rows to create
   *
   * @return the rows, never null
   */
  static List<Row> numbers(final int count) {
    final List<Row> rows = new ArrayList<>(count);
    for (long i = 1; i <= count; i++) {
      rows.add(row(i, "number", i, "mod3", i % 3));
    }
    return rows;
  }
}
