package org.waabox.crossfilter;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The three lookup structures built for one filterable column.
 *
 * <ul>
 *   <li>the inverted index: value to the set of row identifiers holding
 *       it. Buckets partition the identifier set of the dataset.</li>
 *   <li>the reverse index: row identifier to its value.</li>
 *   <li>the catalog: the distinct values, ascending.</li>
 * </ul>
 *
 * <p>Instances are created by {@link IndexBuilder} and are immutable and
 * thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ColumnIndex {

  /** Base overhead of a HashMap instance. */
  private static final long HASHMAP_BASE = 48L;

  /** Overhead of a HashSet wrapping its own HashMap. */
  private static final long HASHSET_BASE = 16L + HASHMAP_BASE;

  /** Size of a reference in the bucket array. */
  private static final long BUCKET_REF = 8L;

  /** Size of a HashMap.Node (hash + key + value + next + header). */
  private static final long ENTRY_NODE = 32L;

  /** Size of a boxed Long or Double. */
  private static final long BOXED_NUMBER = 16L;

  /** Base overhead of an ArrayList instance + internal Object[] header. */
  private static final long ARRAYLIST_HEADER = 40L;

  /** Size of an object reference within an array. */
  private static final long REFERENCE = 8L;

  /** The column name. */
  private final String name;

  /** Value to row identifiers. */
  private final Map<Double, Set<Long>> buckets;

  /** Row identifier to value. */
  private final Map<Long, Double> valuesById;

  /** The distinct values, ascending. */
  private final List<Double> uniqueValues;

  /**
   * Creates a new column index. The given maps are taken over, not copied;
   * the builder must not touch them afterwards.
   *
   * @param name         the column name, never null
   * @param buckets      the inverted index, never null
   * @param valuesById   the reverse index, never null
   * @param uniqueValues the sorted distinct values, never null
   */
  ColumnIndex(final String name, final Map<Double, Set<Long>> buckets,
      final Map<Long, Double> valuesById, final List<Double> uniqueValues) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(buckets, "buckets must not be null");
    Objects.requireNonNull(valuesById, "valuesById must not be null");
    Objects.requireNonNull(uniqueValues, "uniqueValues must not be null");

    final Map<Double, Set<Long>> frozen = new HashMap<>(buckets.size() * 2);
    for (final Map.Entry<Double, Set<Long>> entry : buckets.entrySet()) {
      frozen.put(entry.getKey(),
          Collections.unmodifiableSet(entry.getValue()));
    }
    this.buckets = Collections.unmodifiableMap(frozen);
    this.valuesById = Collections.unmodifiableMap(valuesById);
    this.uniqueValues = Collections.unmodifiableList(uniqueValues);
  }

  /**
   * Returns the column name.
   *
   * @return the column name, never null
   */
  public String name() {
    return name;
  }

  /**
   * Returns the identifiers of the rows holding the given value.
   *
   * <p>A value that does not occur in the column yields an empty set.
   *
   * @param value the value to look up
   *
   * @return an unmodifiable set of row identifiers, never null
   */
  public Set<Long> rowIds(final double value) {
    final Set<Long> ids = buckets.get(value);
    if (ids == null) {
      return Collections.emptySet();
    }
    return ids;
  }

  /**
   * Returns the value the given row holds in this column.
   *
   * @param rowId the row identifier
   *
   * @return the value, or null if the row is not part of the dataset
   */
  public Double valueOf(final long rowId) {
    return valuesById.get(rowId);
  }

  /**
   * Returns the inverted index of this column.
   *
   * @return an unmodifiable map of value to row identifiers, never null
   */
  public Map<Double, Set<Long>> buckets() {
    return buckets;
  }

  /**
   * Returns the reverse index of this column.
   *
   * @return an unmodifiable map of row identifier to value, never null
   */
  public Map<Long, Double> valuesById() {
    return valuesById;
  }

  /**
   * Returns the distinct values of this column in ascending order.
   *
   * @return an unmodifiable sorted list, never null
   */
  public List<Double> uniqueValues() {
    return uniqueValues;
  }

  /**
   * Returns whether the value occurs in this column.
   *
   * @param value the value to check
   *
   * @return true if at least one row holds it
   */
  public boolean contains(final double value) {
    return buckets.containsKey(value);
  }

  /**
   * Computes statistics for this column, including an estimated memory
   * footprint based on JVM structural heuristics.
   *
   * <p>The estimate counts both hash maps (base, bucket array, entry
   * nodes), one HashSet per distinct value, the boxed keys and the sorted
   * catalog list.
   *
   * @return the column info, never null
   */
  public ColumnInfo info() {
    final int distinct = buckets.size();
    final int rows = valuesById.size();

    final long invertedBytes = HASHMAP_BASE
        + tableSize(distinct) * BUCKET_REF
        + distinct * (ENTRY_NODE + BOXED_NUMBER + HASHSET_BASE)
        + rows * (BUCKET_REF * 2 + ENTRY_NODE + BOXED_NUMBER);

    final long reverseBytes = HASHMAP_BASE
        + tableSize(rows) * BUCKET_REF
        + rows * (ENTRY_NODE + BOXED_NUMBER);

    final long catalogBytes = ARRAYLIST_HEADER + distinct * REFERENCE;

    return new ColumnInfo(name, distinct, rows,
        invertedBytes + reverseBytes + catalogBytes);
  }

  private static long tableSize(final int entries) {
    return nextPowerOfTwo(Math.max(16, (long) (entries / 0.75) + 1));
  }

  private static long nextPowerOfTwo(final long value) {
    long n = value - 1;
    n |= n >>> 1;
    n |= n >>> 2;
    n |= n >>> 4;
    n |= n >>> 8;
    n |= n >>> 16;
    n |= n >>> 32;
    return n + 1;
  }
}
