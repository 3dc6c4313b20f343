package org.waabox.crossfilter;

import java.util.List;

/**
 * A strategy for producing the rows of a dataset.
 *
 * <p>Implementations fetch the complete dataset from wherever it lives
 * (a file, a database, an API) and hand it over already parsed. The engine
 * performs no parsing or type coercion of its own.
 *
 * <p>The loader is invoked on every {@code refresh}. It must return the
 * full dataset; partial loads are not supported.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RowLoader {

  /**
   * Loads all rows from the underlying source.
   *
   * <p>An empty list is a valid return value; building an index over it
   * fails with {@link EmptyDatasetException}.
   *
   * @return a list of rows, never null
   */
  List<Row> load();
}
