package org.waabox.crossfilter;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The user's current selections: for each column, the set of values picked
 * in it.
 *
 * <p>A column with an empty selection, or with no entry at all, is
 * inactive and imposes no constraint. A non-empty selection matches a row
 * if the row holds any of the selected values in that column; selections
 * on different columns must all match.
 *
 * <p>FilterState is an immutable value. Every mutation returns a new
 * instance, so a state handed to {@link IntersectionEngine} can never
 * change underneath it. Selected values are not checked against the
 * column catalog: a value absent from the index matches no row and
 * contributes nothing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FilterState {

  /** The state with no known columns. */
  private static final FilterState EMPTY = new FilterState(
      Collections.emptyMap());

  /** Column to selected values, in column order. Sets are unmodifiable. */
  private final Map<String, Set<Double>> selections;

  /**
   * Creates a new FilterState. The map is taken over, not copied.
   *
   * @param selections the selections by column, never null
   */
  private FilterState(final Map<String, Set<Double>> selections) {
    this.selections = Collections.unmodifiableMap(selections);
  }

  /**
   * Returns the state with no columns at all.
   *
   * @return the empty state, never null
   */
  public static FilterState empty() {
    return EMPTY;
  }

  /**
   * Creates a state with one empty selection per column; this is the state
   * a freshly indexed dataset starts with.
   *
   * @param columns the column names, never null
   *
   * @return the new state, never null
   */
  public static FilterState forColumns(final Collection<String> columns) {
    Objects.requireNonNull(columns, "columns must not be null");
    final Map<String, Set<Double>> selections = new LinkedHashMap<>();
    for (final String column : columns) {
      Objects.requireNonNull(column, "column must not be null");
      selections.put(column, Collections.emptySet());
    }
    return new FilterState(selections);
  }

  /**
   * Replaces the selection of a column.
   *
   * @param column the column name, never null
   * @param values the values to select, never null; an empty collection
   *               makes the column inactive
   *
   * @return the new state, never null
   */
  public FilterState setFilter(final String column,
      final Collection<? extends Number> values) {
    Objects.requireNonNull(column, "column must not be null");
    Objects.requireNonNull(values, "values must not be null");
    final Set<Double> normalized = new HashSet<>();
    for (final Number value : values) {
      normalized.add(Values.normalize(value));
    }
    return with(column, normalized);
  }

  /**
   * Empties the selection of a column, making it inactive.
   *
   * @param column the column name, never null
   *
   * @return the new state, never null
   */
  public FilterState clearFilter(final String column) {
    Objects.requireNonNull(column, "column must not be null");
    return with(column, Collections.emptySet());
  }

  /**
   * Empties the selection of every known column.
   *
   * @return the new state, never null
   */
  public FilterState clearAll() {
    return forColumns(selections.keySet());
  }

  /**
   * Adds a value to the selection of a column, or removes it if it was
   * already selected.
   *
   * @param column the column name, never null
   * @param value  the value to toggle, never null
   *
   * @return the new state, never null
   */
  public FilterState toggle(final String column, final Number value) {
    Objects.requireNonNull(column, "column must not be null");
    final double normalized = Values.normalize(value);
    final Set<Double> next = new HashSet<>(selected(column));
    if (!next.remove(normalized)) {
      next.add(normalized);
    }
    return with(column, next);
  }

  /**
   * Selects every visible value of a column, or clears the column if its
   * selection is already as large as the visible list.
   *
   * <p>This backs a "select all" control over an option list that may be
   * narrowed by a search term.
   *
   * @param column        the column name, never null
   * @param visibleValues the values currently offered, never null
   *
   * @return the new state, never null
   */
  public FilterState toggleAll(final String column,
      final Collection<? extends Number> visibleValues) {
    Objects.requireNonNull(column, "column must not be null");
    Objects.requireNonNull(visibleValues, "visibleValues must not be null");
    if (selected(column).size() == visibleValues.size()) {
      return clearFilter(column);
    }
    return setFilter(column, visibleValues);
  }

  /**
   * Returns the values selected for a column.
   *
   * @param column the column name, never null
   *
   * @return an unmodifiable set, empty if the column is inactive or
   *         unknown, never null
   */
  public Set<Double> selected(final String column) {
    Objects.requireNonNull(column, "column must not be null");
    final Set<Double> values = selections.get(column);
    if (values == null) {
      return Collections.emptySet();
    }
    return values;
  }

  /**
   * Returns whether the column has a non-empty selection.
   *
   * @param column the column name, never null
   *
   * @return true if the column constrains the result
   */
  public boolean isActive(final String column) {
    return !selected(column).isEmpty();
  }

  /**
   * Returns whether any column has a non-empty selection.
   *
   * @return true if at least one column is active
   */
  public boolean hasActiveFilters() {
    for (final Set<Double> values : selections.values()) {
      if (!values.isEmpty()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the active columns and their selections, in column order.
   *
   * @return an unmodifiable map holding only non-empty selections,
   *         never null
   */
  public Map<String, Set<Double>> activeFilters() {
    final Map<String, Set<Double>> active = new LinkedHashMap<>();
    for (final Map.Entry<String, Set<Double>> entry : selections.entrySet()) {
      if (!entry.getValue().isEmpty()) {
        active.put(entry.getKey(), entry.getValue());
      }
    }
    return Collections.unmodifiableMap(active);
  }

  /**
   * Returns every column known to this state, active or not.
   *
   * @return an unmodifiable set of column names, never null
   */
  public Set<String> columns() {
    return selections.keySet();
  }

  private FilterState with(final String column, final Set<Double> values) {
    final Map<String, Set<Double>> next = new LinkedHashMap<>(selections);
    next.put(column, values.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(values));
    return new FilterState(next);
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof FilterState that)) {
      return false;
    }
    return selections.equals(that.selections);
  }

  @Override
  public int hashCode() {
    return selections.hashCode();
  }

  @Override
  public String toString() {
    return "FilterState" + selections;
  }
}
