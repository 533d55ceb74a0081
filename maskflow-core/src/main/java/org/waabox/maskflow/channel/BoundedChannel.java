package org.waabox.maskflow.channel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.waabox.maskflow.PipelineConfigurationException;

/**
 * A fixed-capacity FIFO channel between one producer and one consumer.
 *
 * <p>{@link #put(Object)} blocks while the channel holds {@link #capacity()}
 * elements and {@link #take()} blocks while it is empty. Both wait on lock
 * conditions, there is no polling. The blocking put is the backpressure that
 * keeps the producer from running arbitrarily far ahead of the consumer.
 *
 * <p>Either side can end the conversation:
 * <ul>
 *   <li>{@link #close()} is called by the consumer when it goes away.
 *       Buffered elements are discarded and every current or future
 *       {@code put} throws {@link ChannelClosedException}.</li>
 *   <li>{@link #fail(Throwable)} is called on behalf of a producer that
 *       died. Elements already buffered are still delivered, then
 *       {@code take} throws {@link ChannelClosedException} carrying the
 *       cause.</li>
 * </ul>
 *
 * <p>Instances are created per pipeline run and handed to both sides by
 * reference. This class is thread-safe.
 *
 * @param <E> the type of the elements carried by this channel
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class BoundedChannel<E> {

  /** The maximum number of buffered elements, always positive. */
  private final int capacity;

  /** The buffered elements, head is the oldest. Guarded by lock. */
  private final Deque<E> elements;

  /** The lock guarding all mutable state. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Signalled when an element is removed or the channel ends. */
  private final Condition notFull = lock.newCondition();

  /** Signalled when an element is added or the channel ends. */
  private final Condition notEmpty = lock.newCondition();

  /** Whether the consumer closed the channel. Guarded by lock. */
  private boolean closed;

  /** The producer failure, null while the producer is healthy. */
  private Throwable failure;

  /** The largest number of buffered elements observed. Guarded by lock. */
  private int highWaterMark;

  /**
   * Creates a new channel.
   *
   * @param capacity the maximum number of buffered elements, must be
   *                 greater than zero
   *
   * @throws PipelineConfigurationException if capacity is not positive
   */
  public BoundedChannel(final int capacity) {
    if (capacity <= 0) {
      throw new PipelineConfigurationException(
          "channel capacity must be greater than 0, got: " + capacity);
    }
    this.capacity = capacity;
    this.elements = new ArrayDeque<>(capacity);
  }

  /**
   * Appends an element, waiting while the channel is full.
   *
   * @param element the element to append, never null
   *
   * @throws InterruptedException   if the calling thread is interrupted
   *                                while waiting
   * @throws ChannelClosedException if the channel was closed or failed
   *                                before the element could be appended
   */
  public void put(final E element) throws InterruptedException {
    Objects.requireNonNull(element, "element must not be null");
    lock.lockInterruptibly();
    try {
      while (isOpen() && elements.size() == capacity) {
        notFull.await();
      }
      if (closed) {
        throw new ChannelClosedException(
            "Channel was closed by the consumer");
      }
      if (failure != null) {
        throw new ChannelClosedException(
            "Channel already failed", failure);
      }
      elements.addLast(element);
      highWaterMark = Math.max(highWaterMark, elements.size());
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the oldest element, waiting while the channel is
   * empty.
   *
   * @return the oldest element, never null
   *
   * @throws InterruptedException   if the calling thread is interrupted
   *                                while waiting
   * @throws ChannelClosedException if the channel was closed, or if it
   *                                failed and no buffered elements remain
   */
  public E take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (elements.isEmpty()) {
        if (closed) {
          throw new ChannelClosedException("Channel is closed");
        }
        if (failure != null) {
          throw new ChannelClosedException(
              "Producer failed: " + failure, failure);
        }
        notEmpty.await();
      }
      final E element = elements.removeFirst();
      notFull.signal();
      return element;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the channel from the consumer side.
   *
   * <p>Discards buffered elements and wakes up both sides. Calling it more
   * than once has no further effect.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
      elements.clear();
      notFull.signalAll();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks the producer side as failed.
   *
   * <p>Only the first failure is kept. Has no effect on a closed channel.
   *
   * @param cause the reason the producer stopped, never null
   */
  public void fail(final Throwable cause) {
    Objects.requireNonNull(cause, "cause must not be null");
    lock.lock();
    try {
      if (!closed && failure == null) {
        failure = cause;
      }
      notFull.signalAll();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns whether the consumer closed this channel.
   *
   * @return true once {@link #close()} was called
   */
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the maximum number of buffered elements.
   *
   * @return the capacity, always greater than zero
   */
  public int capacity() {
    return capacity;
  }

  /**
   * Returns the number of elements currently buffered.
   *
   * @return the current size, between zero and {@link #capacity()}
   */
  public int size() {
    lock.lock();
    try {
      return elements.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the largest number of elements ever buffered at once.
   *
   * @return the high-water mark, never greater than {@link #capacity()}
   */
  public int highWaterMark() {
    lock.lock();
    try {
      return highWaterMark;
    } finally {
      lock.unlock();
    }
  }

  /** Must be called while holding the lock. */
  private boolean isOpen() {
    return !closed && failure == null;
  }
}
