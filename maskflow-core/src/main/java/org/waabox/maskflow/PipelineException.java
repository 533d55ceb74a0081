package org.waabox.maskflow;

/**
 * Base exception for all fatal pipeline errors.
 *
 * <p>This is an unchecked exception. Per-item load failures never surface
 * as a {@code PipelineException}; they are recovered inside the load worker
 * and reported as skips. Only failures that make the whole run meaningless
 * (a misconfigured run, a dead producer or a vanished consumer) are raised
 * through this hierarchy.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PipelineException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public PipelineException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, may be null.
   */
  public PipelineException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
