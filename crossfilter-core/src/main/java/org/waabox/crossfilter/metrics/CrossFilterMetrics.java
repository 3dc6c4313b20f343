package org.waabox.crossfilter.metrics;

/**
 * An abstraction for recording operational metrics of the cross-filter
 * engine.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer, Prometheus, or Datadog. Use {@link NoopCrossFilterMetrics}
 * when metrics collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CrossFilterMetrics {

  /**
   * Records a successfully installed index.
   *
   * @param version    the dataset version of the index
   * @param rowCount   the number of indexed rows
   * @param durationMs the time spent loading and building, in milliseconds
   */
  void indexBuilt(long version, int rowCount, long durationMs);

  /**
   * Records a failed index build.
   *
   * @param cause the throwable that caused the failure, never null
   */
  void buildFailed(Throwable cause);

  /**
   * Records a build that was abandoned because a newer dataset was
   * submitted.
   *
   * @param version the dataset version of the abandoned build
   */
  void buildSuperseded(long version);

  /**
   * Records the execution of a query against the installed index.
   *
   * @param query      the kind of query (e.g. "eligibleIds",
   *                   "availableValues"), never null
   * @param durationNs the query duration in nanoseconds
   */
  void queryExecuted(String query, long durationNs);
}
