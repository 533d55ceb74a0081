package org.waabox.maskflow;

import java.util.List;
import java.util.Objects;

/**
 * An ordered group of successfully loaded payloads delivered together.
 *
 * <p>Every batch but the last of a run holds exactly the configured batch
 * size; the last may be shorter. Batches are never empty. The sequence
 * number starts at zero and grows by one per batch, in the order the load
 * worker enqueued them.
 *
 * <p>This class is immutable; the payloads themselves are owned by whoever
 * dequeued the batch.
 *
 * @param <T> the payload type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Batch<T> {

  /** The zero-based position of this batch in the stream. */
  private final long sequence;

  /** The payloads, never null nor empty. */
  private final List<T> items;

  /**
   * Creates a new batch.
   *
   * @param sequence the zero-based position in the stream, never negative
   * @param items    the payloads, never null nor empty
   *
   * @throws IllegalArgumentException if sequence is negative or items is
   *                                  empty
   */
  public Batch(final long sequence, final List<T> items) {
    Objects.requireNonNull(items, "items must not be null");
    if (sequence < 0) {
      throw new IllegalArgumentException(
          "sequence must not be negative, got: " + sequence);
    }
    if (items.isEmpty()) {
      throw new IllegalArgumentException("a batch must not be empty");
    }
    this.sequence = sequence;
    this.items = List.copyOf(items);
  }

  /**
   * Returns the zero-based position of this batch in the stream.
   *
   * @return the sequence number
   */
  public long sequence() {
    return sequence;
  }

  /**
   * Returns the payloads of this batch.
   *
   * @return an unmodifiable list, never null nor empty
   */
  public List<T> items() {
    return items;
  }

  /**
   * Returns the number of payloads in this batch.
   *
   * @return the size, always greater than zero
   */
  public int size() {
    return items.size();
  }

  @Override
  public String toString() {
    return "Batch[sequence=" + sequence + ", size=" + items.size() + "]";
  }
}
