package org.waabox.maskflow;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.maskflow.LoadReport.SkippedItem;
import org.waabox.maskflow.channel.BoundedChannel;
import org.waabox.maskflow.channel.ChannelClosedException;
import org.waabox.maskflow.metrics.PipelineMetrics;

/**
 * The producer side of a pipeline run.
 *
 * <p>Turns a list of identifiers into a stream of {@link Batch batches} on
 * a {@link BoundedChannel}:
 * <ol>
 *   <li>Each identifier is handed to the {@link ItemLoader} inside a fault
 *       isolation boundary. A skip result, a {@code null} result or any
 *       thrown {@link Exception} is logged, counted and the loop moves on
 *       to the next identifier.</li>
 *   <li>Loaded payloads are collected into the current batch. A full batch
 *       is put on the channel, which blocks while the channel is full.</li>
 *   <li>Once the identifiers are exhausted, a non-empty partial batch is
 *       put, followed by exactly one end-of-stream sentinel carrying the
 *       {@link LoadReport}.</li>
 * </ol>
 *
 * <p>Losing the consumer is fatal: if the channel is closed, or the worker
 * thread is interrupted while waiting on it, {@link #run()} throws
 * {@link ChannelClosedException} and nothing else is loaded.
 *
 * <p>A worker runs once. It is meant to be the only code running on its
 * thread; all its state is private to that thread except the channel.
 *
 * @param <I> the identifier type
 * @param <T> the payload type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LoadWorker<I, T> implements Runnable {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(LoadWorker.class);

  /** The identifiers to load, in load order. */
  private final List<I> identifiers;

  /** The item loader. */
  private final ItemLoader<I, T> loader;

  /** The number of payloads per batch. */
  private final int batchSize;

  /** The channel to the consumer. */
  private final BoundedChannel<StreamSignal<T>> channel;

  /** The metrics reporter. */
  private final PipelineMetrics metrics;

  /** Whether this worker already ran. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /**
   * Creates a new load worker.
   *
   * @param identifiers the identifiers to load, in load order, never null
   * @param loader      the item loader, never null
   * @param batchSize   the number of payloads per batch, greater than zero
   * @param channel     the channel to the consumer, never null
   * @param metrics     the metrics reporter, never null
   *
   * @throws IllegalArgumentException if batchSize is not positive
   */
  public LoadWorker(final List<I> identifiers, final ItemLoader<I, T> loader,
      final int batchSize, final BoundedChannel<StreamSignal<T>> channel,
      final PipelineMetrics metrics) {
    Objects.requireNonNull(identifiers, "identifiers must not be null");
    Objects.requireNonNull(loader, "loader must not be null");
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(metrics, "metrics must not be null");
    if (batchSize <= 0) {
      throw new IllegalArgumentException(
          "batchSize must be greater than 0, got: " + batchSize);
    }
    this.identifiers = List.copyOf(identifiers);
    this.loader = loader;
    this.batchSize = batchSize;
    this.channel = channel;
    this.metrics = metrics;
  }

  /**
   * Loads every identifier and feeds the channel, ending with the sentinel.
   *
   * @throws ChannelClosedException if the consumer went away
   * @throws IllegalStateException  if this worker already ran
   */
  @Override
  public void run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("A load worker can only run once");
    }
    log.info("Load worker started: {} items, batch size {}",
        identifiers.size(), batchSize);

    final List<SkippedItem> skipped = new ArrayList<>();
    List<T> current = new ArrayList<>(batchSize);
    int loaded = 0;
    long sequence = 0;

    for (final I identifier : identifiers) {
      ensureConsumerPresent();

      final LoadResult<T> result = attempt(identifier);
      if (!result.isLoaded()) {
        final String reason = result.reason().orElse("skipped");
        skipped.add(new SkippedItem(String.valueOf(identifier), reason));
        metrics.itemSkipped(reason);
        continue;
      }

      current.add(result.payload());
      loaded++;
      if (current.size() == batchSize) {
        enqueue(new Batch<>(sequence++, current));
        current = new ArrayList<>(batchSize);
      }
    }

    if (!current.isEmpty()) {
      enqueue(new Batch<>(sequence++, current));
    }

    final LoadReport report = new LoadReport(identifiers.size(), loaded,
        sequence, skipped);
    put(StreamSignal.endOfStream(report));
    metrics.runCompleted(report);

    log.info("Load worker finished: {}", report);
  }

  /**
   * Loads one item inside the fault isolation boundary.
   *
   * @param identifier the item to load, never null
   *
   * @return the loader result, or a skip if it failed, never null
   */
  private LoadResult<T> attempt(final I identifier) {
    final long start = System.nanoTime();
    final LoadResult<T> result;
    try {
      result = loader.load(identifier);
    } catch (final Exception e) {
      log.warn("Error loading {}, skipping: {}", identifier,
          e.getMessage(), e);
      return LoadResult.skipped("loader failed: " + e, e);
    }
    if (result == null) {
      log.warn("Loader returned no result for {}, skipping", identifier);
      return LoadResult.skipped("loader returned no result");
    }
    if (result.isLoaded()) {
      metrics.itemLoaded(System.nanoTime() - start);
    } else {
      log.warn("Skipping {}: {}", identifier, result.reason().orElse(""));
    }
    return result;
  }

  /**
   * Puts a full or final batch on the channel.
   *
   * @param batch the batch, never null
   */
  private void enqueue(final Batch<T> batch) {
    final long start = System.nanoTime();
    put(StreamSignal.batch(batch));
    metrics.batchEnqueued(batch.size(), System.nanoTime() - start);
    log.debug("Enqueued {}", batch);
  }

  /**
   * Puts a signal on the channel, blocking while it is full.
   *
   * @param signal the signal, never null
   *
   * @throws ChannelClosedException if the channel is closed or the thread
   *                                is interrupted while waiting
   */
  private void put(final StreamSignal<T> signal) {
    try {
      channel.put(signal);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChannelClosedException(
          "Load worker interrupted while waiting for the consumer", e);
    }
  }

  /**
   * Stops the loop early once nobody is listening.
   *
   * @throws ChannelClosedException if the channel is closed or the thread
   *                                was interrupted
   */
  private void ensureConsumerPresent() {
    if (channel.isClosed()) {
      throw new ChannelClosedException("Channel was closed by the consumer");
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new ChannelClosedException("Load worker was interrupted");
    }
  }
}
