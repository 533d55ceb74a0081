package org.waabox.maskflow.metrics;

import org.waabox.maskflow.LoadReport;

/**
 * A no-operation implementation of {@link PipelineMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopPipelineMetrics implements PipelineMetrics {

  /** {@inheritDoc} */
  @Override
  public void itemLoaded(final long durationNanos) {
  }

  /** {@inheritDoc} */
  @Override
  public void itemSkipped(final String reason) {
  }

  /** {@inheritDoc} */
  @Override
  public void batchEnqueued(final int size, final long waitNanos) {
  }

  /** {@inheritDoc} */
  @Override
  public void runCompleted(final LoadReport report) {
  }
}
