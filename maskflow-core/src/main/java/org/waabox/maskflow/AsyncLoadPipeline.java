package org.waabox.maskflow;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.maskflow.channel.BoundedChannel;
import org.waabox.maskflow.channel.ChannelClosedException;
import org.waabox.maskflow.metrics.NoopPipelineMetrics;
import org.waabox.maskflow.metrics.PipelineMetrics;

/**
 * The main entry point of the loading pipeline.
 *
 * <p>Wires one {@link ItemEnumerator}, one {@link ItemLoader} and a
 * {@link PipelineConfig} into runs. Each call to {@link #open()}:
 * <ol>
 *   <li>Enumerates the dataset on the calling thread, so configuration
 *       errors surface immediately as
 *       {@link PipelineConfigurationException}.</li>
 *   <li>Creates a {@link BoundedChannel} sized by
 *       {@link PipelineConfig#queueCapacity()}.</li>
 *   <li>Starts a {@link LoadWorker} on its own daemon thread.</li>
 *   <li>Returns the {@link BatchStream} the caller consumes.</li>
 * </ol>
 *
 * <p>The loader is chosen when the pipeline is built; the worker never
 * inspects which implementation it got.
 *
 * <p>Usage example:
 * <pre>{@code
 * AsyncLoadPipeline<ImageContourPair, LabeledImage> pipeline =
 *     AsyncLoadPipeline.builder(new LinkFileEnumerator(),
 *         new DicomContourLoader())
 *     .datasetRoot(Path.of("final_data"))
 *     .config(PipelineConfig.of(8, 2, EnumerationOptions.shuffled(42)))
 *     .build();
 *
 * try (BatchStream<LabeledImage> batches = pipeline.open()) {
 *   batches.forEachRemaining(this::train);
 * }
 * }</pre>
 *
 * @param <I> the identifier type
 * @param <T> the payload type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AsyncLoadPipeline<I, T> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AsyncLoadPipeline.class);

  /** The default name of the worker thread. */
  static final String DEFAULT_WORKER_THREAD_NAME = "maskflow-load-worker";

  /** The dataset enumerator. */
  private final ItemEnumerator<I> enumerator;

  /** The item loader. */
  private final ItemLoader<I, T> loader;

  /** The dataset root directory. */
  private final Path datasetRoot;

  /** The run configuration. */
  private final PipelineConfig config;

  /** The metrics reporter. */
  private final PipelineMetrics metrics;

  /** The name given to worker threads. */
  private final String workerThreadName;

  /**
   * Creates a new pipeline.
   *
   * @param enumerator       the enumerator, never null
   * @param loader           the loader, never null
   * @param datasetRoot      the dataset root, never null
   * @param config           the configuration, never null
   * @param metrics          the metrics reporter, never null
   * @param workerThreadName the worker thread name, never null
   */
  private AsyncLoadPipeline(final ItemEnumerator<I> enumerator,
      final ItemLoader<I, T> loader, final Path datasetRoot,
      final PipelineConfig config, final PipelineMetrics metrics,
      final String workerThreadName) {
    this.enumerator = enumerator;
    this.loader = loader;
    this.datasetRoot = datasetRoot;
    this.config = config;
    this.metrics = metrics;
    this.workerThreadName = workerThreadName;
  }

  /**
   * Creates a new builder for a pipeline.
   *
   * @param <I>        the identifier type
   * @param <T>        the payload type
   * @param enumerator the dataset enumerator, never null
   * @param loader     the item loader, never null
   *
   * @return a new builder, never null
   *
   * @throws NullPointerException if any argument is null
   */
  public static <I, T> Builder<I, T> builder(
      final ItemEnumerator<I> enumerator, final ItemLoader<I, T> loader) {
    Objects.requireNonNull(enumerator, "enumerator must not be null");
    Objects.requireNonNull(loader, "loader must not be null");
    return new Builder<>(enumerator, loader);
  }

  /**
   * Starts a new run.
   *
   * @return the stream of batches of this run, never null
   *
   * @throws PipelineConfigurationException if the dataset structure is not
   *                                        recognized
   */
  public BatchStream<T> open() {
    final List<I> identifiers =
        enumerator.enumerate(datasetRoot, config.enumeration());
    log.info("Enumerated {} items under {} ({})", identifiers.size(),
        datasetRoot, config);

    final BoundedChannel<StreamSignal<T>> channel =
        new BoundedChannel<>(config.queueCapacity());
    final LoadWorker<I, T> worker = new LoadWorker<>(identifiers, loader,
        config.batchSize(), channel, metrics);

    final Thread thread = new Thread(() -> runWorker(worker, channel),
        workerThreadName);
    thread.setDaemon(true);
    thread.start();

    return new BatchStream<>(channel, thread);
  }

  /**
   * Returns the run configuration.
   *
   * @return the configuration, never null
   */
  public PipelineConfig config() {
    return config;
  }

  /**
   * Returns the dataset root directory.
   *
   * @return the dataset root, never null
   */
  public Path datasetRoot() {
    return datasetRoot;
  }

  /**
   * Returns the item loader this pipeline was built with.
   *
   * @return the loader, never null
   */
  public ItemLoader<I, T> loader() {
    return loader;
  }

  /**
   * Runs the worker and turns anything escaping it into a channel failure
   * the consumer can observe.
   *
   * @param <I>     the identifier type
   * @param <T>     the payload type
   * @param worker  the worker to run, never null
   * @param channel the worker channel, never null
   */
  private static <I, T> void runWorker(final LoadWorker<I, T> worker,
      final BoundedChannel<StreamSignal<T>> channel) {
    try {
      worker.run();
    } catch (final ChannelClosedException e) {
      log.info("Load worker stopped: {}", e.getMessage());
      channel.fail(e);
    } catch (final RuntimeException e) {
      log.error("Load worker crashed: {}", e.getMessage(), e);
      channel.fail(e);
    } catch (final Error e) {
      log.error("Load worker died: {}", e.getMessage(), e);
      channel.fail(e);
      throw e;
    }
  }

  /**
   * A fluent builder for constructing {@link AsyncLoadPipeline} instances.
   *
   * <p>The dataset root is required. Defaults:
   * <ul>
   *   <li>config: {@link PipelineConfig#defaults()}</li>
   *   <li>metrics: {@link NoopPipelineMetrics}</li>
   *   <li>workerThreadName: {@code maskflow-load-worker}</li>
   * </ul>
   *
   * @param <I> the identifier type
   * @param <T> the payload type
   */
  public static final class Builder<I, T> {

    /** The dataset enumerator. */
    private final ItemEnumerator<I> enumerator;

    /** The item loader. */
    private final ItemLoader<I, T> loader;

    /** The dataset root directory. */
    private Path datasetRoot;

    /** The optional run configuration. */
    private PipelineConfig config;

    /** The optional metrics reporter. */
    private PipelineMetrics metrics;

    /** The optional worker thread name. */
    private String workerThreadName;

    /**
     * Creates a new builder.
     *
     * @param enumerator the enumerator, never null
     * @param loader     the loader, never null
     */
    private Builder(final ItemEnumerator<I> enumerator,
        final ItemLoader<I, T> loader) {
      this.enumerator = enumerator;
      this.loader = loader;
    }

    /**
     * Sets the dataset root directory handed to the enumerator.
     *
     * @param theDatasetRoot the dataset root, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder<I, T> datasetRoot(final Path theDatasetRoot) {
      Objects.requireNonNull(theDatasetRoot, "datasetRoot must not be null");
      this.datasetRoot = theDatasetRoot;
      return this;
    }

    /**
     * Sets the run configuration.
     *
     * <p>If not set, {@link PipelineConfig#defaults()} is used.
     *
     * @param theConfig the configuration, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder<I, T> config(final PipelineConfig theConfig) {
      Objects.requireNonNull(theConfig, "config must not be null");
      this.config = theConfig;
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * <p>If not set, {@link NoopPipelineMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder<I, T> metrics(final PipelineMetrics theMetrics) {
      Objects.requireNonNull(theMetrics, "metrics must not be null");
      this.metrics = theMetrics;
      return this;
    }

    /**
     * Sets the name of the worker thread.
     *
     * @param theName the thread name, never null or empty
     *
     * @return this builder for chaining, never null
     *
     * @throws IllegalArgumentException if theName is empty
     */
    public Builder<I, T> workerThreadName(final String theName) {
      Objects.requireNonNull(theName, "workerThreadName must not be null");
      if (theName.isEmpty()) {
        throw new IllegalArgumentException(
            "workerThreadName must not be empty");
      }
      this.workerThreadName = theName;
      return this;
    }

    /**
     * Builds the pipeline.
     *
     * @return a new pipeline, never null
     *
     * @throws PipelineConfigurationException if no dataset root was set
     */
    public AsyncLoadPipeline<I, T> build() {
      if (datasetRoot == null) {
        throw new PipelineConfigurationException(
            "A dataset root is required");
      }
      final PipelineConfig resolvedConfig = config != null
          ? config : PipelineConfig.defaults();
      final PipelineMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopPipelineMetrics();
      final String resolvedName = workerThreadName != null
          ? workerThreadName : DEFAULT_WORKER_THREAD_NAME;

      return new AsyncLoadPipeline<>(enumerator, loader, datasetRoot,
          resolvedConfig, resolvedMetrics, resolvedName);
    }
  }
}
