package org.waabox.maskflow.channel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Test;
import org.waabox.maskflow.PipelineConfigurationException;

/**
 * Tests for {@link BoundedChannel}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class BoundedChannelTest {

  @Test
  void whenCreating_givenZeroCapacity_shouldThrow() {
    assertThrows(PipelineConfigurationException.class,
        () -> new BoundedChannel<String>(0));
  }

  @Test
  void whenCreating_givenNegativeCapacity_shouldThrow() {
    assertThrows(PipelineConfigurationException.class,
        () -> new BoundedChannel<String>(-3));
  }

  @Test
  void whenTaking_givenSeveralPuts_shouldPreserveFifoOrder()
      throws Exception {
    final BoundedChannel<String> channel = new BoundedChannel<>(3);

    channel.put("a");
    channel.put("b");
    channel.put("c");

    assertEquals("a", channel.take());
    assertEquals("b", channel.take());
    assertEquals("c", channel.take());
    assertEquals(0, channel.size());
  }

  @Test
  void whenPutting_givenNullElement_shouldThrowNpe() {
    final BoundedChannel<String> channel = new BoundedChannel<>(1);

    assertThrows(NullPointerException.class, () -> channel.put(null));
  }

  @Test
  void whenPutting_givenFullChannel_shouldBlockUntilTaken()
      throws Exception {
    final BoundedChannel<Integer> channel = new BoundedChannel<>(2);
    channel.put(1);
    channel.put(2);

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<?> producer = executor.submit(() -> {
        channel.put(3);
        return null;
      });

      assertThrows(TimeoutException.class,
          () -> producer.get(200, TimeUnit.MILLISECONDS));
      assertEquals(2, channel.size());

      assertEquals(1, channel.take());
      producer.get(5, TimeUnit.SECONDS);

      assertEquals(2, channel.take());
      assertEquals(3, channel.take());
      assertEquals(2, channel.highWaterMark());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenTaking_givenEmptyChannel_shouldBlockUntilPut() throws Exception {
    final BoundedChannel<String> channel = new BoundedChannel<>(1);

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<String> consumer = executor.submit(channel::take);

      assertThrows(TimeoutException.class,
          () -> consumer.get(200, TimeUnit.MILLISECONDS));

      channel.put("late");
      assertEquals("late", consumer.get(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenClosing_givenBlockedProducer_shouldFailThePut() throws Exception {
    final BoundedChannel<String> channel = new BoundedChannel<>(1);
    channel.put("first");

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<?> producer = executor.submit(() -> {
        channel.put("second");
        return null;
      });
      assertThrows(TimeoutException.class,
          () -> producer.get(100, TimeUnit.MILLISECONDS));

      channel.close();

      final ExecutionException error = assertThrows(ExecutionException.class,
          () -> producer.get(5, TimeUnit.SECONDS));
      assertInstanceOf(ChannelClosedException.class, error.getCause());
      assertTrue(channel.isClosed());
      assertEquals(0, channel.size());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenTaking_givenClosedChannel_shouldThrow() {
    final BoundedChannel<String> channel = new BoundedChannel<>(1);
    channel.close();

    assertThrows(ChannelClosedException.class, channel::take);
    assertThrows(ChannelClosedException.class, () -> channel.put("x"));
  }

  @Test
  void whenFailing_givenBufferedElements_shouldDeliverThemBeforeFailure()
      throws Exception {
    final BoundedChannel<String> channel = new BoundedChannel<>(2);
    channel.put("a");
    channel.put("b");

    final IllegalStateException cause = new IllegalStateException("crash");
    channel.fail(cause);

    assertEquals("a", channel.take());
    assertEquals("b", channel.take());

    final ChannelClosedException error =
        assertThrows(ChannelClosedException.class, channel::take);
    assertSame(cause, error.getCause());
    assertFalse(channel.isClosed());
  }

  @Test
  void whenFailing_givenBlockedConsumer_shouldWakeItWithTheCause()
      throws Exception {
    final BoundedChannel<String> channel = new BoundedChannel<>(1);

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<String> consumer = executor.submit(channel::take);
      assertThrows(TimeoutException.class,
          () -> consumer.get(100, TimeUnit.MILLISECONDS));

      final OutOfMemoryError cause = new OutOfMemoryError("simulated");
      channel.fail(cause);

      final ExecutionException error = assertThrows(ExecutionException.class,
          () -> consumer.get(5, TimeUnit.SECONDS));
      assertInstanceOf(ChannelClosedException.class, error.getCause());
      assertSame(cause, error.getCause().getCause());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void whenFailingTwice_givenTwoCauses_shouldKeepTheFirst() {
    final BoundedChannel<String> channel = new BoundedChannel<>(1);
    final RuntimeException first = new RuntimeException("first");

    channel.fail(first);
    channel.fail(new RuntimeException("second"));

    final ChannelClosedException error =
        assertThrows(ChannelClosedException.class, channel::take);
    assertSame(first, error.getCause());
  }

  @Test
  void whenExchanging_givenFastProducerAndSlowConsumer_shouldNeverExceedCapacity()
      throws Exception {
    final int capacity = 3;
    final int total = 200;
    final BoundedChannel<Integer> channel = new BoundedChannel<>(capacity);
    final CountDownLatch done = new CountDownLatch(1);
    final List<Integer> received = new ArrayList<>();
    final List<Integer> observedSizes = new ArrayList<>();

    final Thread producer = new Thread(() -> {
      try {
        for (int i = 0; i < total; i++) {
          channel.put(i);
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        done.countDown();
      }
    });
    producer.start();

    for (int i = 0; i < total; i++) {
      observedSizes.add(channel.size());
      received.add(channel.take());
      if (i % 50 == 0) {
        Thread.sleep(5);
      }
    }

    assertTrue(done.await(5, TimeUnit.SECONDS));
    producer.join();

    for (int i = 0; i < total; i++) {
      assertEquals(i, received.get(i));
    }
    for (final int size : observedSizes) {
      assertTrue(size <= capacity, "size " + size + " exceeds capacity");
    }
    assertTrue(channel.highWaterMark() <= capacity);
  }
}
