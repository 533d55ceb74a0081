package org.waabox.maskflow;

import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of loading one item: either a loaded payload or a skip.
 *
 * <p>Loaders report expected per-item failures (a corrupt image, a
 * malformed annotation) as a skip instead of throwing, so the failure is
 * part of the {@link ItemLoader} signature. A skip always carries a human
 * readable reason and optionally the exception that caused it.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @param <T> the type of the loaded payload
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LoadResult<T> {

  /** The loaded payload, null for a skip. */
  private final T payload;

  /** The reason for the skip, null for a loaded result. */
  private final String reason;

  /** The failure behind the skip, may be null. */
  private final Throwable cause;

  /**
   * Creates a new result.
   *
   * @param payload the payload, null for a skip
   * @param reason  the skip reason, null for a loaded result
   * @param cause   the skip cause, may be null
   */
  private LoadResult(final T payload, final String reason,
      final Throwable cause) {
    this.payload = payload;
    this.reason = reason;
    this.cause = cause;
  }

  /**
   * Creates a loaded result.
   *
   * @param <T>     the payload type
   * @param payload the loaded payload, never null
   *
   * @return a loaded result, never null
   *
   * @throws NullPointerException if payload is null
   */
  public static <T> LoadResult<T> loaded(final T payload) {
    Objects.requireNonNull(payload, "payload must not be null");
    return new LoadResult<>(payload, null, null);
  }

  /**
   * Creates a skip without an underlying exception.
   *
   * @param <T>    the payload type
   * @param reason why the item was skipped, never null
   *
   * @return a skip result, never null
   */
  public static <T> LoadResult<T> skipped(final String reason) {
    Objects.requireNonNull(reason, "reason must not be null");
    return new LoadResult<>(null, reason, null);
  }

  /**
   * Creates a skip caused by an exception.
   *
   * @param <T>    the payload type
   * @param reason why the item was skipped, never null
   * @param cause  the failure behind the skip, never null
   *
   * @return a skip result, never null
   */
  public static <T> LoadResult<T> skipped(final String reason,
      final Throwable cause) {
    Objects.requireNonNull(reason, "reason must not be null");
    Objects.requireNonNull(cause, "cause must not be null");
    return new LoadResult<>(null, reason, cause);
  }

  /**
   * Returns whether this result carries a payload.
   *
   * @return true if loaded, false if skipped
   */
  public boolean isLoaded() {
    return payload != null;
  }

  /**
   * Returns the loaded payload.
   *
   * @return the payload, never null
   *
   * @throws IllegalStateException if this result is a skip
   */
  public T payload() {
    if (payload == null) {
      throw new IllegalStateException(
          "Skipped result has no payload: " + reason);
    }
    return payload;
  }

  /**
   * Returns the skip reason.
   *
   * @return the reason, empty for a loaded result
   */
  public Optional<String> reason() {
    return Optional.ofNullable(reason);
  }

  /**
   * Returns the failure behind the skip.
   *
   * @return the cause, empty for a loaded result or a skip without one
   */
  public Optional<Throwable> cause() {
    return Optional.ofNullable(cause);
  }

  @Override
  public String toString() {
    return isLoaded()
        ? "LoadResult[loaded=" + payload + "]"
        : "LoadResult[skipped=" + reason + "]";
  }
}
