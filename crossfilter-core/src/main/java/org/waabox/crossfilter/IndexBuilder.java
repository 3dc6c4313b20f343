package org.waabox.crossfilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link FilterIndex} from a dataset in a single pass.
 *
 * <p>For every row, the builder records the row in the forward map and,
 * for every requested column, adds the row identifier to the bucket of its
 * value and records the value in the reverse index. Once all rows are
 * seen, each column's distinct values are sorted ascending to form its
 * catalog; that sort is the only step that is not linear.
 *
 * <p>Row identifiers are assumed unique. A repeated identifier replaces
 * the earlier row everywhere, so each identifier still lands in exactly
 * one bucket per column, and is reported once in the log.
 *
 * <p>The builder keeps no state between calls and is safe to use from
 * several threads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class IndexBuilder {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      IndexBuilder.class);

  /** How many rows are processed between two cancellation checks. */
  private static final int CANCELLATION_CHECK_INTERVAL = 1024;

  /** Utility class. */
  private IndexBuilder() {
  }

  /**
   * Builds an index with version 1 that cannot be cancelled.
   *
   * @param rows    the dataset rows, never null
   * @param columns the filterable column names, never null
   *
   * @return the built index, never null
   *
   * @throws EmptyDatasetException    if rows is empty
   * @throws MalformedRowException    if a row lacks a numeric value for a
   *                                  requested column
   * @throws IllegalArgumentException if a column name is empty or repeated
   */
  public static FilterIndex build(final List<Row> rows,
      final List<String> columns) {
    return build(rows, columns, 1L, () -> false);
  }

  /**
   * Builds an index for the given dataset version.
   *
   * <p>The cancellation flag is polled every
   * {@value #CANCELLATION_CHECK_INTERVAL} rows; once it reports true, the
   * build is abandoned and nothing is returned.
   *
   * @param rows      the dataset rows, never null
   * @param columns   the filterable column names, never null
   * @param version   the dataset version to stamp on the index
   * @param cancelled tells whether the build has been superseded,
   *                  never null
   *
   * @return the built index, never null
   *
   * @throws EmptyDatasetException    if rows is empty
   * @throws MalformedRowException    if a row lacks a numeric value for a
   *                                  requested column
   * @throws IllegalArgumentException if a column name is empty or repeated
   * @throws CancellationException    if the build was cancelled
   */
  public static FilterIndex build(final List<Row> rows,
      final List<String> columns, final long version,
      final BooleanSupplier cancelled) {
    Objects.requireNonNull(rows, "rows must not be null");
    Objects.requireNonNull(columns, "columns must not be null");
    Objects.requireNonNull(cancelled, "cancelled must not be null");

    if (rows.isEmpty()) {
      throw new EmptyDatasetException();
    }
    checkColumns(columns);

    final int columnCount = columns.size();
    final Map<Long, Row> rowsById = new HashMap<>(capacityFor(rows.size()));

    final List<Map<Double, Set<Long>>> buckets = new ArrayList<>(columnCount);
    final List<Map<Long, Double>> valuesById = new ArrayList<>(columnCount);
    for (int i = 0; i < columnCount; i++) {
      buckets.add(new HashMap<>());
      valuesById.add(new HashMap<>(capacityFor(rows.size())));
    }

    int duplicates = 0;
    int processed = 0;

    for (final Row row : rows) {
      if (++processed % CANCELLATION_CHECK_INTERVAL == 0
          && cancelled.getAsBoolean()) {
        throw new CancellationException(
            "Index build for version " + version + " was cancelled");
      }

      final long id = row.id();
      final boolean replaced = rowsById.put(id, row) != null;
      if (replaced) {
        duplicates++;
      }

      for (int c = 0; c < columnCount; c++) {
        final double value = row.number(columns.get(c));
        final Double previous = valuesById.get(c).put(id, value);
        if (replaced && previous != null) {
          unlink(buckets.get(c), previous, id);
        }
        buckets.get(c).computeIfAbsent(value, v -> new HashSet<>()).add(id);
      }
    }

    if (cancelled.getAsBoolean()) {
      throw new CancellationException(
          "Index build for version " + version + " was cancelled");
    }

    if (duplicates > 0) {
      log.warn("Dataset version {} repeats {} row identifier(s); later rows"
          + " replaced earlier ones", version, duplicates);
    }

    final Map<String, ColumnIndex> columnIndices = new LinkedHashMap<>();
    for (int c = 0; c < columnCount; c++) {
      final List<Double> unique = new ArrayList<>(buckets.get(c).keySet());
      Collections.sort(unique);
      final String name = columns.get(c);
      columnIndices.put(name, new ColumnIndex(name, buckets.get(c),
          valuesById.get(c), unique));
    }

    return new FilterIndex(rowsById, columnIndices, version);
  }

  /**
   * Validates the requested column names.
   *
   * @param columns the column names, never null
   *
   * @throws IllegalArgumentException if a name is empty or repeated
   */
  private static void checkColumns(final List<String> columns) {
    final Set<String> seen = new HashSet<>();
    for (final String column : columns) {
      Objects.requireNonNull(column, "column must not be null");
      if (column.isEmpty()) {
        throw new IllegalArgumentException("column must not be empty");
      }
      if (!seen.add(column)) {
        throw new IllegalArgumentException(
            "Duplicate column name: '" + column + "'");
      }
    }
  }

  /**
   * Removes a row from the bucket of its former value, dropping the bucket
   * once it is empty.
   *
   * @param buckets the inverted index of one column, never null
   * @param value   the former value
   * @param id      the row identifier
   */
  private static void unlink(final Map<Double, Set<Long>> buckets,
      final Double value, final long id) {
    final Set<Long> bucket = buckets.get(value);
    if (bucket != null && bucket.remove(id) && bucket.isEmpty()) {
      buckets.remove(value);
    }
  }

  private static int capacityFor(final int entries) {
    return (int) Math.min(Integer.MAX_VALUE, (long) (entries / 0.75f) + 1);
  }
}
