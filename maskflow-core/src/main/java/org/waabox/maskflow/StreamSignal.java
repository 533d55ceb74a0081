package org.waabox.maskflow;

import java.util.Objects;

/**
 * One element of the channel between the load worker and the consumer:
 * either a {@link Batch} or the end-of-stream sentinel.
 *
 * <p>The sentinel is enqueued exactly once per successful run, as the last
 * element, and carries the final {@link LoadReport}.
 *
 * @param <T> the payload type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamSignal<T> {

  /** The batch, null for the sentinel. */
  private final Batch<T> batch;

  /** The run report, null for a batch signal. */
  private final LoadReport report;

  private StreamSignal(final Batch<T> batch, final LoadReport report) {
    this.batch = batch;
    this.report = report;
  }

  /**
   * Wraps a batch.
   *
   * @param <T>   the payload type
   * @param batch the batch, never null
   *
   * @return a batch signal, never null
   */
  public static <T> StreamSignal<T> batch(final Batch<T> batch) {
    Objects.requireNonNull(batch, "batch must not be null");
    return new StreamSignal<>(batch, null);
  }

  /**
   * Creates the end-of-stream sentinel.
   *
   * @param <T>    the payload type
   * @param report the final run report, never null
   *
   * @return the sentinel, never null
   */
  public static <T> StreamSignal<T> endOfStream(final LoadReport report) {
    Objects.requireNonNull(report, "report must not be null");
    return new StreamSignal<>(null, report);
  }

  /**
   * Returns whether this is the end-of-stream sentinel.
   *
   * @return true for the sentinel
   */
  public boolean isEndOfStream() {
    return batch == null;
  }

  /**
   * Returns the wrapped batch.
   *
   * @return the batch, never null
   *
   * @throws IllegalStateException if this is the sentinel
   */
  public Batch<T> batch() {
    if (batch == null) {
      throw new IllegalStateException("The sentinel carries no batch");
    }
    return batch;
  }

  /**
   * Returns the final run report carried by the sentinel.
   *
   * @return the report, never null
   *
   * @throws IllegalStateException if this is a batch signal
   */
  public LoadReport report() {
    if (report == null) {
      throw new IllegalStateException("Only the sentinel carries a report");
    }
    return report;
  }

  @Override
  public String toString() {
    return isEndOfStream() ? "StreamSignal[end, " + report + "]"
        : "StreamSignal[" + batch + "]";
  }
}
