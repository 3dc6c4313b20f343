package org.waabox.crossfilter;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Holds aggregated statistics for an index, including per-column info
 * and the total estimated memory footprint.
 *
 * @param version                 the dataset version of the index
 * @param rowCount                the total number of rows
 * @param columns                 the per-column statistics, never null,
 *                                unmodifiable
 * @param totalEstimatedSizeBytes the sum of all column estimated sizes
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record IndexInfo(long version, int rowCount, List<ColumnInfo> columns,
    long totalEstimatedSizeBytes) {

  /**
   * Creates a new IndexInfo instance.
   *
   * @param version                 the dataset version
   * @param rowCount                the total number of rows
   * @param columns                 the per-column statistics, never null
   * @param totalEstimatedSizeBytes the sum of all column estimated sizes
   *
   * @throws NullPointerException if columns is null
   */
  public IndexInfo {
    Objects.requireNonNull(columns, "columns must not be null");
    columns = Collections.unmodifiableList(List.copyOf(columns));
  }

  /**
   * Returns the total estimated memory size in megabytes.
   *
   * @return the total estimated size in MB
   */
  public double totalEstimatedSizeMB() {
    return totalEstimatedSizeBytes / (1024.0 * 1024.0);
  }
}
