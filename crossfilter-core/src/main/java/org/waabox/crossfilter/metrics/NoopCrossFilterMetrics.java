package org.waabox.crossfilter.metrics;

/**
 * A no-operation implementation of {@link CrossFilterMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCrossFilterMetrics implements CrossFilterMetrics {

  /** {@inheritDoc} */
  @Override
  public void indexBuilt(final long version, final int rowCount,
      final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void buildFailed(final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void buildSuperseded(final long version) {
  }

  /** {@inheritDoc} */
  @Override
  public void queryExecuted(final String query, final long durationNs) {
  }
}
