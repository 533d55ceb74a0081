package org.waabox.maskflow.runner;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.waabox.maskflow.AsyncLoadPipeline;
import org.waabox.maskflow.Batch;
import org.waabox.maskflow.BatchStream;
import org.waabox.maskflow.LoadReport;
import org.waabox.maskflow.LoadReport.SkippedItem;
import org.waabox.maskflow.PipelineConfigurationException;
import org.waabox.maskflow.channel.ChannelClosedException;
import org.waabox.maskflow.dicom.ImageContourPair;
import org.waabox.maskflow.dicom.LabeledImage;

/**
 * Consumes one pass of the pipeline and logs what it receives.
 *
 * <p>Every batch is logged with its sequence and size, every item with
 * its study and slice. When the stream ends the totals and each skipped
 * item are logged. The outcome is kept as the exit code of the
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class BatchFeedRunner implements CommandLineRunner, ExitCodeGenerator {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(BatchFeedRunner.class);

  /** The exit code of a completed run, skips included. */
  public static final int EXIT_COMPLETED = 0;

  /** The exit code of a misconfigured run. */
  public static final int EXIT_CONFIGURATION_ERROR = 2;

  /** The exit code of a run whose load worker failed. */
  public static final int EXIT_CHANNEL_FAILURE = 3;

  /** The pipeline factory. */
  private final PipelineFactory factory;

  /** The exit code of the last run. */
  private int exitCode = EXIT_COMPLETED;

  /** The report of the last completed run, null until then. */
  private LoadReport report;

  /**
   * Creates a new runner.
   *
   * @param theFactory the pipeline factory, never null
   */
  public BatchFeedRunner(final PipelineFactory theFactory) {
    factory = Objects.requireNonNull(theFactory, "factory must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void run(final String... args) {
    try {
      report = consume(factory.create());
      exitCode = EXIT_COMPLETED;
      log.info("Run {}: {} of {} items loaded in {} batches, {} skipped",
          report.status(), report.loaded(), report.enumerated(),
          report.batches(), report.skipped());
      for (final SkippedItem skipped : report.skippedItems()) {
        log.info("Skipped {}: {}", skipped.identifier(), skipped.reason());
      }
    } catch (final PipelineConfigurationException e) {
      exitCode = EXIT_CONFIGURATION_ERROR;
      log.error("Invalid configuration: {}", e.getMessage());
    } catch (final ChannelClosedException e) {
      exitCode = EXIT_CHANNEL_FAILURE;
      log.error("Load worker failed: {}", e.getMessage(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public int getExitCode() {
    return exitCode;
  }

  /**
   * Returns the report of the last completed run.
   *
   * @return the report, or null if no run completed
   */
  public LoadReport report() {
    return report;
  }

  private <T> LoadReport consume(
      final AsyncLoadPipeline<ImageContourPair, T> pipeline) {
    try (BatchStream<T> batches = pipeline.open()) {
      while (batches.hasNext()) {
        final Batch<T> batch = batches.next();
        log.info("Batch {}: {} items", batch.sequence(), batch.size());
        for (final T item : batch.items()) {
          log.info("  {}", describe(item));
        }
      }
      return batches.report();
    }
  }

  /** Returns a one line description of a loaded item. */
  static String describe(final Object item) {
    if (item instanceof LabeledImage) {
      final LabeledImage labeled = (LabeledImage) item;
      return labeled.source().studyId() + " slice "
          + labeled.source().sliceNumber() + " "
          + labeled.image().width() + "x" + labeled.image().height()
          + ", mask " + labeled.mask().count() + " px";
    }
    if (item instanceof ImageContourPair) {
      final ImageContourPair pair = (ImageContourPair) item;
      return pair.studyId() + " slice " + pair.sliceNumber() + " "
          + pair.imagePath().getFileName() + " <-> "
          + pair.contourPath().getFileName();
    }
    return String.valueOf(item);
  }
}
