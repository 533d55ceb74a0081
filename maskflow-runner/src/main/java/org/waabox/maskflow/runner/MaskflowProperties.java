package org.waabox.maskflow.runner;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.maskflow.PipelineConfig;

/**
 * Configuration properties for the runner, mapped from the
 * {@code maskflow.*} prefix in application.yml or the environment
 * (e.g. {@code MASKFLOW_LOADER=stub}).
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code maskflow.data-dir} - the dataset root, defaults to
 *       {@code final_data}.</li>
 *   <li>{@code maskflow.batch-size} - items per batch, defaults to 8.</li>
 *   <li>{@code maskflow.queue-capacity} - batches buffered ahead of the
 *       consumer, defaults to 2.</li>
 *   <li>{@code maskflow.loader} - {@code production} or {@code stub}.</li>
 *   <li>{@code maskflow.shuffle} - whether to shuffle the items, defaults
 *       to true.</li>
 *   <li>{@code maskflow.seed} - the shuffle seed; unset means a different
 *       order on every run.</li>
 *   <li>{@code maskflow.contour-kind} - {@code i-contours} or
 *       {@code o-contours}.</li>
 * </ul>
 *
 * <p>Values are kept as given; they are validated when the pipeline is
 * built so a bad value is reported as a configuration error of the run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "maskflow")
public class MaskflowProperties {

  /** The dataset root directory. */
  private String dataDir = "final_data";

  /** The number of items per batch. */
  private int batchSize = PipelineConfig.DEFAULT_BATCH_SIZE;

  /** The number of batches buffered ahead of the consumer. */
  private int queueCapacity = PipelineConfig.DEFAULT_QUEUE_CAPACITY;

  /** The loader mode name. */
  private String loader = "production";

  /** Whether to shuffle the enumerated items. */
  private boolean shuffle = true;

  /** The shuffle seed, null for an unseeded shuffle. */
  private Long seed;

  /** The contour directory name. */
  private String contourKind = "i-contours";

  public String getDataDir() {
    return dataDir;
  }

  public void setDataDir(final String dataDir) {
    this.dataDir = dataDir;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(final int batchSize) {
    this.batchSize = batchSize;
  }

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(final int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public String getLoader() {
    return loader;
  }

  public void setLoader(final String loader) {
    this.loader = loader;
  }

  public boolean isShuffle() {
    return shuffle;
  }

  public void setShuffle(final boolean shuffle) {
    this.shuffle = shuffle;
  }

  /**
   * Returns the shuffle seed.
   *
   * @return the seed, or null if every run should shuffle differently
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(final Long seed) {
    this.seed = seed;
  }

  public String getContourKind() {
    return contourKind;
  }

  public void setContourKind(final String contourKind) {
    this.contourKind = contourKind;
  }
}
