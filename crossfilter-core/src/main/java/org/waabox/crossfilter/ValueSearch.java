package org.waabox.crossfilter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Narrows an option list to the values whose display text contains a
 * search term, ignoring case.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ValueSearch {

  /** Utility class. */
  private ValueSearch() {
  }

  /**
   * Returns the values whose {@link Values#format(double) display text}
   * contains the term.
   *
   * @param values the option list, never null
   * @param term   the search term, may be null or empty to keep every
   *               value
   *
   * @return the matching values in their original order, never null
   */
  public static List<Double> matching(final List<Double> values,
      final String term) {
    Objects.requireNonNull(values, "values must not be null");
    if (term == null || term.isEmpty()) {
      return values;
    }
    final String needle = term.toLowerCase(Locale.ROOT);
    final List<Double> result = new ArrayList<>();
    for (final Double value : values) {
      if (Values.format(value).toLowerCase(Locale.ROOT).contains(needle)) {
        result.add(value);
      }
    }
    return Collections.unmodifiableList(result);
  }
}
