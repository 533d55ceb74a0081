package org.waabox.maskflow;

/**
 * Thrown when a pipeline run is misconfigured.
 *
 * <p>Covers invalid batch sizes or channel capacities and dataset roots
 * whose structure is not recognized by the enumerator. It is always raised
 * before the load worker starts, so no partial output is ever produced for
 * a misconfigured run.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PipelineConfigurationException extends PipelineException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public PipelineConfigurationException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, never null
   */
  public PipelineConfigurationException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
