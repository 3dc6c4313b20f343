package org.waabox.crossfilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers the two cross-filtering questions over an index and a filter
 * state: which rows pass every active filter, and which values are still
 * selectable in a column given the filters on all the other columns.
 *
 * <p>Within a column the selected values are OR-ed: the column's matching
 * rows are the union of the buckets of its selected values. Active columns
 * are then AND-ed by intersecting those unions. Each intersection step
 * walks the smaller operand and probes the larger one, and the fold stops
 * as soon as the running result is empty.
 *
 * <p>Every method is a pure function of its arguments: nothing is cached
 * or mutated, so calls may run concurrently as long as they are given a
 * consistent index and filter state.
 *
 * <p>Filter columns that are not part of the index are rejected with
 * {@link UnknownColumnException} when active, and ignored when inactive.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class IntersectionEngine {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      IntersectionEngine.class);

  /** Utility class. */
  private IntersectionEngine() {
  }

  /**
   * Computes the identifiers of the rows that satisfy every active filter.
   *
   * <p>With no active filter the full identifier set is returned. The
   * iteration order of the result is unspecified.
   *
   * @param index   the index to query, never null
   * @param filters the filter state, never null
   *
   * @return an unmodifiable set of row identifiers, never null
   *
   * @throws UnknownColumnException if an active filter names a column
   *                                that is not indexed
   */
  public static Set<Long> eligibleIds(final FilterIndex index,
      final FilterState filters) {
    Objects.requireNonNull(index, "index must not be null");
    Objects.requireNonNull(filters, "filters must not be null");
    final Set<Long> eligible = intersectActive(index, filters, null);
    if (eligible == null) {
      return index.rowIds();
    }
    return Collections.unmodifiableSet(eligible);
  }

  /**
   * Returns the rows that satisfy every active filter, ordered by
   * ascending identifier.
   *
   * @param index   the index to query, never null
   * @param filters the filter state, never null
   *
   * @return an unmodifiable list of rows, never null
   *
   * @throws UnknownColumnException if an active filter names a column
   *                                that is not indexed
   */
  public static List<Row> eligibleRows(final FilterIndex index,
      final FilterState filters) {
    final Set<Long> ids = eligibleIds(index, filters);
    final List<Long> sorted = new ArrayList<>(ids);
    Collections.sort(sorted);
    final Map<Long, Row> rowsById = index.rowsById();
    final List<Row> rows = new ArrayList<>(sorted.size());
    for (final Long id : sorted) {
      rows.add(rowsById.get(id));
    }
    return Collections.unmodifiableList(rows);
  }

  /**
   * Computes the values still selectable in a column, given the filters
   * active on every other column.
   *
   * <p>The column's own selection is left out, so a column never narrows
   * its own option list. When no other column is active the column's full
   * catalog is returned; when the other filters match no row the result
   * is empty.
   *
   * @param index        the index to query, never null
   * @param filters      the filter state, never null
   * @param targetColumn the column to compute options for, never null
   *
   * @return an unmodifiable list of distinct values, ascending, never null
   *
   * @throws UnknownColumnException if the target column, or an active
   *                                filter column, is not indexed
   */
  public static List<Double> availableValues(final FilterIndex index,
      final FilterState filters, final String targetColumn) {
    Objects.requireNonNull(index, "index must not be null");
    Objects.requireNonNull(filters, "filters must not be null");
    Objects.requireNonNull(targetColumn, "targetColumn must not be null");

    final ColumnIndex target = index.column(targetColumn);
    final Set<Long> eligible = intersectActive(index, filters, targetColumn);

    if (eligible == null) {
      return target.uniqueValues();
    }
    if (eligible.isEmpty()) {
      return Collections.emptyList();
    }

    final Set<Double> reachable = new HashSet<>();
    for (final Long id : eligible) {
      reachable.add(target.valueOf(id));
    }
    final List<Double> values = new ArrayList<>(reachable);
    Collections.sort(values);
    return Collections.unmodifiableList(values);
  }

  /**
   * Computes the selectable values of every indexed column.
   *
   * @param index   the index to query, never null
   * @param filters the filter state, never null
   *
   * @return an unmodifiable map of column name to its available values,
   *         in column order, never null
   *
   * @throws UnknownColumnException if an active filter names a column
   *                                that is not indexed
   */
  public static Map<String, List<Double>> availableValues(
      final FilterIndex index, final FilterState filters) {
    Objects.requireNonNull(index, "index must not be null");
    final Map<String, List<Double>> result = new LinkedHashMap<>();
    for (final String column : index.columnNames()) {
      result.put(column, availableValues(index, filters, column));
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Intersects the row sets of all active columns except the excluded one.
   *
   * @param index    the index, never null
   * @param filters  the filter state, never null
   * @param excluded the column to leave out, may be null
   *
   * @return the eligible identifiers, or null if no column constrains the
   *         result. The returned set may be a bucket of the index and must
   *         not be modified.
   */
  private static Set<Long> intersectActive(final FilterIndex index,
      final FilterState filters, final String excluded) {

    final Map<String, Set<Double>> active = filters.activeFilters();

    // Validate first so an early empty result cannot hide a bad column.
    final List<ColumnIndex> columns = new ArrayList<>(active.size());
    final List<Set<Double>> selections = new ArrayList<>(active.size());
    for (final Map.Entry<String, Set<Double>> entry : active.entrySet()) {
      if (entry.getKey().equals(excluded)) {
        continue;
      }
      columns.add(index.column(entry.getKey()));
      selections.add(entry.getValue());
    }

    Set<Long> eligible = null;
    for (int i = 0; i < columns.size(); i++) {
      final Set<Long> matching = union(columns.get(i), selections.get(i));
      eligible = eligible == null ? matching : intersect(eligible, matching);
      if (eligible.isEmpty()) {
        return Collections.emptySet();
      }
    }
    return eligible;
  }

  /**
   * Unions the buckets of the selected values of one column.
   *
   * @param column   the column index, never null
   * @param selected the selected values, never null or empty
   *
   * @return the matching identifiers, never null
   */
  private static Set<Long> union(final ColumnIndex column,
      final Set<Double> selected) {
    if (selected.size() == 1) {
      final double value = selected.iterator().next();
      logIfStale(column, value);
      return column.rowIds(value);
    }
    int expected = 0;
    for (final Double value : selected) {
      expected += column.rowIds(value).size();
    }
    final Set<Long> ids = new HashSet<>((int) (expected / 0.75f) + 1);
    for (final Double value : selected) {
      logIfStale(column, value);
      ids.addAll(column.rowIds(value));
    }
    return ids;
  }

  /**
   * Intersects two sets by walking the smaller one and probing the larger.
   *
   * @param a the first set, never null
   * @param b the second set, never null
   *
   * @return a new set holding the common identifiers, never null
   */
  private static Set<Long> intersect(final Set<Long> a, final Set<Long> b) {
    final Set<Long> smaller = a.size() <= b.size() ? a : b;
    final Set<Long> larger = smaller == a ? b : a;
    final Set<Long> result = new HashSet<>();
    for (final Long id : smaller) {
      if (larger.contains(id)) {
        result.add(id);
      }
    }
    return result;
  }

  private static void logIfStale(final ColumnIndex column,
      final double value) {
    if (log.isDebugEnabled() && !column.contains(value)) {
      log.debug("Selected value {} does not occur in column '{}', ignored",
          Values.format(value), column.name());
    }
  }
}
