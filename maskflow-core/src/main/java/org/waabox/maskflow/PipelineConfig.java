package org.waabox.maskflow;

import java.util.Objects;

/**
 * Tuning of one pipeline run: batch size, channel capacity and the order
 * in which identifiers are loaded.
 *
 * <p>Instances are created through static factory methods. The defaults
 * are a batch size of 8, a channel capacity of 2 batches and a random
 * shuffle. The capacity bounds memory: the producer can never be more than
 * {@code queueCapacity} full batches (plus the one it is assembling) ahead
 * of the consumer.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PipelineConfig {

  /** The default number of payloads per batch. */
  public static final int DEFAULT_BATCH_SIZE = 8;

  /** The default channel capacity, in batches. */
  public static final int DEFAULT_QUEUE_CAPACITY = 2;

  /** The number of payloads per batch. */
  private final int batchSize;

  /** The channel capacity, in batches. */
  private final int queueCapacity;

  /** The identifier ordering. */
  private final EnumerationOptions enumeration;

  /**
   * Creates a new configuration.
   *
   * @param batchSize     the batch size, greater than zero
   * @param queueCapacity the channel capacity, greater than zero
   * @param enumeration   the identifier ordering, never null
   */
  private PipelineConfig(final int batchSize, final int queueCapacity,
      final EnumerationOptions enumeration) {
    this.batchSize = batchSize;
    this.queueCapacity = queueCapacity;
    this.enumeration = enumeration;
  }

  /**
   * Creates a configuration with the given parameters.
   *
   * @param batchSize     the number of payloads per batch, must be greater
   *                      than zero
   * @param queueCapacity the channel capacity in batches, must be greater
   *                      than zero
   * @param enumeration   the identifier ordering, never null
   *
   * @return a new configuration, never null
   *
   * @throws PipelineConfigurationException if batchSize or queueCapacity is
   *                                        not positive
   * @throws NullPointerException           if enumeration is null
   */
  public static PipelineConfig of(final int batchSize,
      final int queueCapacity, final EnumerationOptions enumeration) {
    if (batchSize <= 0) {
      throw new PipelineConfigurationException(
          "batchSize must be greater than 0, got: " + batchSize);
    }
    if (queueCapacity <= 0) {
      throw new PipelineConfigurationException(
          "queueCapacity must be greater than 0, got: " + queueCapacity);
    }
    Objects.requireNonNull(enumeration, "enumeration must not be null");
    return new PipelineConfig(batchSize, queueCapacity, enumeration);
  }

  /**
   * Creates a configuration with the default channel capacity and a random
   * shuffle.
   *
   * @param batchSize the number of payloads per batch, must be greater
   *                  than zero
   *
   * @return a new configuration, never null
   */
  public static PipelineConfig ofBatchSize(final int batchSize) {
    return of(batchSize, DEFAULT_QUEUE_CAPACITY,
        EnumerationOptions.shuffledRandomly());
  }

  /**
   * Creates a configuration with all defaults.
   *
   * @return the default configuration, never null
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(DEFAULT_BATCH_SIZE, DEFAULT_QUEUE_CAPACITY,
        EnumerationOptions.shuffledRandomly());
  }

  /**
   * Returns the number of payloads per batch.
   *
   * @return the batch size, always greater than zero
   */
  public int batchSize() {
    return batchSize;
  }

  /**
   * Returns the channel capacity in batches.
   *
   * @return the capacity, always greater than zero
   */
  public int queueCapacity() {
    return queueCapacity;
  }

  /**
   * Returns the identifier ordering.
   *
   * @return the options, never null
   */
  public EnumerationOptions enumeration() {
    return enumeration;
  }

  @Override
  public String toString() {
    return "PipelineConfig[batchSize=" + batchSize
        + ", queueCapacity=" + queueCapacity
        + ", enumeration=" + enumeration + "]";
  }
}
