package org.waabox.maskflow.runner;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.maskflow.AsyncLoadPipeline;
import org.waabox.maskflow.EnumerationOptions;
import org.waabox.maskflow.ItemLoader;
import org.waabox.maskflow.LoaderMode;
import org.waabox.maskflow.PipelineConfig;
import org.waabox.maskflow.PipelineConfigurationException;
import org.waabox.maskflow.StubItemLoader;
import org.waabox.maskflow.dicom.ContourKind;
import org.waabox.maskflow.dicom.DicomContourLoader;
import org.waabox.maskflow.dicom.ImageContourPair;
import org.waabox.maskflow.dicom.LinkFileEnumerator;
import org.waabox.maskflow.metrics.PipelineMetrics;

/**
 * Builds the pipeline described by {@link MaskflowProperties}.
 *
 * <p>The loader is picked here, once, from {@code maskflow.loader}: the
 * DICOM loader in production mode, the identity loader in stub mode. The
 * rest of the run never looks at the mode again.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PipelineFactory {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PipelineFactory.class);

  /** The runner properties. */
  private final MaskflowProperties properties;

  /** The metrics reporter handed to every pipeline. */
  private final PipelineMetrics metrics;

  /**
   * Creates a new factory.
   *
   * @param theProperties the runner properties, never null
   * @param theMetrics    the metrics reporter, never null
   */
  public PipelineFactory(final MaskflowProperties theProperties,
      final PipelineMetrics theMetrics) {
    properties = Objects.requireNonNull(theProperties,
        "properties must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Returns the configured loader mode.
   *
   * @return the loader mode, never null
   *
   * @throws PipelineConfigurationException if the mode is unknown
   */
  public LoaderMode loaderMode() {
    return LoaderMode.parse(properties.getLoader());
  }

  /**
   * Builds the pipeline.
   *
   * @return the pipeline, never null
   *
   * @throws PipelineConfigurationException if any property is invalid
   */
  public AsyncLoadPipeline<ImageContourPair, ?> create() {
    final LoaderMode mode = loaderMode();
    final PipelineConfig config = PipelineConfig.of(properties.getBatchSize(),
        properties.getQueueCapacity(), enumerationOptions());
    final LinkFileEnumerator enumerator = new LinkFileEnumerator(
        ContourKind.fromDirectoryName(properties.getContourKind()));
    final Path dataDir = dataDir();

    log.info("Building {} pipeline over {} ({}, {})", mode, dataDir, config,
        enumerator.contourKind().directoryName());

    switch (mode) {
      case STUB:
        return build(enumerator, StubItemLoader.<ImageContourPair>identity(),
            dataDir, config);
      case PRODUCTION:
        return build(enumerator, new DicomContourLoader(), dataDir, config);
      default:
        throw new IllegalStateException("Unhandled loader mode: " + mode);
    }
  }

  private Path dataDir() {
    final String dataDir = properties.getDataDir();
    if (dataDir == null || dataDir.isBlank()) {
      throw new PipelineConfigurationException(
          "maskflow.data-dir must not be empty");
    }
    try {
      return Path.of(dataDir);
    } catch (final InvalidPathException e) {
      throw new PipelineConfigurationException(
          "maskflow.data-dir is not a valid path: " + e.getMessage(), e);
    }
  }

  private EnumerationOptions enumerationOptions() {
    if (!properties.isShuffle()) {
      return EnumerationOptions.ordered();
    }
    final Long seed = properties.getSeed();
    return seed == null
        ? EnumerationOptions.shuffledRandomly()
        : EnumerationOptions.shuffled(seed);
  }

  private <T> AsyncLoadPipeline<ImageContourPair, T> build(
      final LinkFileEnumerator enumerator,
      final ItemLoader<ImageContourPair, T> loader, final Path dataDir,
      final PipelineConfig config) {
    return AsyncLoadPipeline.builder(enumerator, loader)
        .datasetRoot(dataDir)
        .config(config)
        .metrics(metrics)
        .build();
  }
}
