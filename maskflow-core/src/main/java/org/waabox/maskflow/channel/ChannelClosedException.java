package org.waabox.maskflow.channel;

import org.waabox.maskflow.PipelineException;

/**
 * Thrown when one side of a {@link BoundedChannel} can no longer talk to
 * the other.
 *
 * <p>The producer sees it when the consumer closed the channel; the
 * consumer sees it when the producer failed it. In both cases the run
 * cannot continue and is not retried.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ChannelClosedException extends PipelineException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception with the given message.
   *
   * @param message the detail message, never null
   */
  public ChannelClosedException(final String message) {
    super(message);
  }

  /**
   * Creates a new exception with the given message and cause.
   *
   * @param message the detail message, never null
   * @param cause   the underlying cause, may be null
   */
  public ChannelClosedException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
