package org.waabox.crossfilter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An immutable, fully built index over one version of a dataset.
 *
 * <p>A FilterIndex holds the forward map (row identifier to row) and one
 * {@link ColumnIndex} per filterable column. It is designed to be held via
 * {@link java.util.concurrent.atomic.AtomicReference} and swapped whole
 * when a new dataset version is indexed; readers never see a half-built
 * index.
 *
 * <p>All collections returned by this class are unmodifiable.
 *
 * <p>Instances are created by {@link IndexBuilder}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FilterIndex {

  /** Row identifier to row. */
  private final Map<Long, Row> rowsById;

  /** The columns by name, in the order they were requested. */
  private final Map<String, ColumnIndex> columns;

  /** The column names, in the order they were requested. */
  private final List<String> columnNames;

  /** The dataset version this index was built for. */
  private final long version;

  /** The instant when this index was built. */
  private final Instant createdAt;

  /**
   * Creates a new index. The given maps are taken over, not copied.
   *
   * @param rowsById the forward map, never null
   * @param columns  the column indices by name, in request order,
   *                 never null
   * @param version  the dataset version
   */
  FilterIndex(final Map<Long, Row> rowsById,
      final Map<String, ColumnIndex> columns, final long version) {
    Objects.requireNonNull(rowsById, "rowsById must not be null");
    Objects.requireNonNull(columns, "columns must not be null");
    this.rowsById = Collections.unmodifiableMap(rowsById);
    this.columns = Collections.unmodifiableMap(columns);
    this.columnNames = Collections.unmodifiableList(
        new ArrayList<>(columns.keySet()));
    this.version = version;
    this.createdAt = Instant.now();
  }

  /**
   * Returns the dataset version of this index.
   *
   * @return the version number
   */
  public long version() {
    return version;
  }

  /**
   * Returns the instant when this index was built.
   *
   * @return the creation timestamp, never null
   */
  public Instant createdAt() {
    return createdAt;
  }

  /**
   * Returns the number of indexed rows.
   *
   * @return the row count
   */
  public int size() {
    return rowsById.size();
  }

  /**
   * Returns the identifiers of every indexed row.
   *
   * @return an unmodifiable set of row identifiers, never null
   */
  public Set<Long> rowIds() {
    return rowsById.keySet();
  }

  /**
   * Looks up a row by its identifier.
   *
   * @param rowId the row identifier
   *
   * @return the row, or empty if it is not part of this index
   */
  public Optional<Row> row(final long rowId) {
    return Optional.ofNullable(rowsById.get(rowId));
  }

  /**
   * Returns the forward map of this index.
   *
   * @return an unmodifiable map of row identifier to row, never null
   */
  public Map<Long, Row> rowsById() {
    return rowsById;
  }

  /**
   * Returns the names of the indexed columns, in the order they were
   * requested.
   *
   * @return an unmodifiable list of column names, never null
   */
  public List<String> columnNames() {
    return columnNames;
  }

  /**
   * Returns whether the given column is indexed.
   *
   * @param column the column name, never null
   *
   * @return true if the column is indexed
   */
  public boolean hasColumn(final String column) {
    Objects.requireNonNull(column, "column must not be null");
    return columns.containsKey(column);
  }

  /**
   * Returns the index of a column.
   *
   * @param column the column name, never null
   *
   * @return the column index, never null
   *
   * @throws UnknownColumnException if the column is not indexed
   */
  public ColumnIndex column(final String column) {
    Objects.requireNonNull(column, "column must not be null");
    final ColumnIndex index = columns.get(column);
    if (index == null) {
      throw new UnknownColumnException(column);
    }
    return index;
  }

  /**
   * Returns the inverted index of a column: value to row identifiers.
   *
   * @param column the column name, never null
   *
   * @return an unmodifiable map, never null
   *
   * @throws UnknownColumnException if the column is not indexed
   */
  public Map<Double, Set<Long>> invertedIndex(final String column) {
    return column(column).buckets();
  }

  /**
   * Returns the reverse index of a column: row identifier to value.
   *
   * @param column the column name, never null
   *
   * @return an unmodifiable map, never null
   *
   * @throws UnknownColumnException if the column is not indexed
   */
  public Map<Long, Double> reverseIndex(final String column) {
    return column(column).valuesById();
  }

  /**
   * Returns the distinct values of a column in ascending order.
   *
   * @param column the column name, never null
   *
   * @return an unmodifiable sorted list, never null
   *
   * @throws UnknownColumnException if the column is not indexed
   */
  public List<Double> uniqueValues(final String column) {
    return column(column).uniqueValues();
  }

  /**
   * Computes statistics for this index, one entry per column.
   *
   * @return the index info, never null
   */
  public IndexInfo info() {
    final List<ColumnInfo> infos = new ArrayList<>(columns.size());
    long total = 0;
    for (final ColumnIndex column : columns.values()) {
      final ColumnInfo info = column.info();
      infos.add(info);
      total += info.estimatedSizeBytes();
    }
    return new IndexInfo(version, size(), infos, total);
  }
}
