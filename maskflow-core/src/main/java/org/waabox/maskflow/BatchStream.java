package org.waabox.maskflow;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.maskflow.channel.BoundedChannel;
import org.waabox.maskflow.channel.ChannelClosedException;

/**
 * The consumer side of a pipeline run.
 *
 * <p>Iterates over the batches produced by the load worker, in the exact
 * order they were enqueued, until the end-of-stream sentinel is observed.
 * {@link #hasNext()} blocks while the worker has not produced the next
 * batch yet. Once the sentinel is seen the worker thread is joined and
 * {@link #report()} becomes available.
 *
 * <p>If the worker dies, the batches it already enqueued are still
 * delivered, after which {@link #hasNext()} throws
 * {@link ChannelClosedException}. A consumer that stops early must
 * {@link #close()} the stream, which closes the channel and stops the
 * worker thread:
 * <pre>{@code
 * try (BatchStream<LabeledImage> batches = pipeline.open()) {
 *   while (batches.hasNext()) {
 *     train(batches.next());
 *   }
 *   log.info("{}", batches.report());
 * }
 * }</pre>
 *
 * <p>A stream must be consumed from a single thread.
 *
 * @param <T> the payload type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BatchStream<T> implements Iterator<Batch<T>>,
    AutoCloseable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(BatchStream.class);

  /** The channel fed by the load worker. */
  private final BoundedChannel<StreamSignal<T>> channel;

  /** The thread running the load worker. */
  private final Thread worker;

  /** The batch fetched by hasNext and not yet returned by next. */
  private Batch<T> next;

  /** The final report, set when the sentinel is observed. */
  private LoadReport report;

  /** The channel failure, set when the worker died. */
  private ChannelClosedException failure;

  /** Whether close was called. */
  private boolean closed;

  /**
   * Creates a new stream over a running worker.
   *
   * @param channel the channel fed by the worker, never null
   * @param worker  the started worker thread, never null
   */
  BatchStream(final BoundedChannel<StreamSignal<T>> channel,
      final Thread worker) {
    this.channel = Objects.requireNonNull(channel, "channel must not be null");
    this.worker = Objects.requireNonNull(worker, "worker must not be null");
  }

  /**
   * Returns whether another batch is available, waiting for the worker if
   * needed.
   *
   * @return true if {@link #next()} will return a batch, false once the
   *         sentinel was observed or the stream was closed
   *
   * @throws ChannelClosedException if the worker died before the sentinel
   */
  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (failure != null) {
      throw failure;
    }
    if (report != null || closed) {
      return false;
    }

    final StreamSignal<T> signal = take();
    if (signal.isEndOfStream()) {
      report = signal.report();
      joinWorker();
      log.info("Batch stream finished: {}", report);
      return false;
    }
    next = signal.batch();
    return true;
  }

  /**
   * Returns the next batch.
   *
   * @return the next batch, never null
   *
   * @throws NoSuchElementException if the stream is exhausted
   * @throws ChannelClosedException if the worker died before the sentinel
   */
  @Override
  public Batch<T> next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more batches");
    }
    final Batch<T> batch = next;
    next = null;
    return batch;
  }

  /**
   * Returns whether the sentinel was observed.
   *
   * @return true once the stream reached its end
   */
  public boolean isFinished() {
    return report != null;
  }

  /**
   * Returns the totals of the run.
   *
   * @return the final report, never null
   *
   * @throws IllegalStateException if the sentinel was not observed yet
   */
  public LoadReport report() {
    if (report == null) {
      throw new IllegalStateException(
          "The report is only available after the last batch");
    }
    return report;
  }

  /**
   * Releases the run.
   *
   * <p>If the sentinel was not observed yet, the channel is closed and the
   * worker thread is interrupted. In every case the worker thread is
   * joined. Calling it more than once has no further effect.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    next = null;
    if (report == null) {
      log.info("Batch stream closed before the end, stopping load worker");
      channel.close();
      worker.interrupt();
    }
    joinWorker();
  }

  /**
   * Takes the next signal from the channel.
   *
   * @return the signal, never null
   *
   * @throws ChannelClosedException if the worker died or the consumer
   *                                thread was interrupted
   */
  private StreamSignal<T> take() {
    try {
      return channel.take();
    } catch (final ChannelClosedException e) {
      failure = e;
      log.error("Load worker failed, aborting the batch stream: {}",
          e.getMessage());
      joinWorker();
      throw e;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      failure = new ChannelClosedException(
          "Interrupted while waiting for the next batch", e);
      close();
      throw failure;
    }
  }

  /** Waits for the worker thread to end. */
  private void joinWorker() {
    try {
      worker.join();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while joining the load worker thread");
    }
  }
}
