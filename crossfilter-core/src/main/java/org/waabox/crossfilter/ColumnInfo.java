package org.waabox.crossfilter;

import java.util.Objects;

/**
 * Holds computed statistics for a single column of an index.
 *
 * @param name               the column name, never null
 * @param distinctValues     the number of distinct values in the column
 * @param rowCount           the number of rows indexed for the column
 * @param estimatedSizeBytes the estimated structural memory overhead in bytes
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ColumnInfo(String name, int distinctValues, int rowCount,
    long estimatedSizeBytes) {

  /** Creates a new ColumnInfo instance.
   *
   * @param name               the column name, never null
   * @param distinctValues     the number of distinct values
   * @param rowCount           the number of rows indexed
   * @param estimatedSizeBytes the estimated memory overhead in bytes
   *
   * @throws NullPointerException if name is null
   */
  public ColumnInfo {
    Objects.requireNonNull(name, "name must not be null");
  }

  /**
   * Returns the estimated memory size in megabytes.
   *
   * @return the estimated size in MB
   */
  public double estimatedSizeMB() {
    return estimatedSizeBytes / (1024.0 * 1024.0);
  }
}
