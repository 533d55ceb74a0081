package org.waabox.maskflow.metrics;

import org.waabox.maskflow.LoadReport;

/**
 * An abstraction for recording operational metrics of a pipeline run.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopPipelineMetrics} when metrics
 * collection is not required.
 *
 * <p>All callbacks are invoked from the load worker thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface PipelineMetrics {

  /**
   * Records a successfully loaded item.
   *
   * @param durationNanos the time spent in the loader, in nanoseconds
   */
  void itemLoaded(long durationNanos);

  /**
   * Records a skipped item.
   *
   * @param reason why the item was skipped, never null
   */
  void itemSkipped(String reason);

  /**
   * Records a batch handed to the channel.
   *
   * @param size          the number of payloads in the batch
   * @param waitNanos     the time the worker was blocked on a full
   *                      channel, in nanoseconds
   */
  void batchEnqueued(int size, long waitNanos);

  /**
   * Records the end of a run, right after the sentinel was enqueued.
   *
   * @param report the final run report, never null
   */
  void runCompleted(LoadReport report);
}
