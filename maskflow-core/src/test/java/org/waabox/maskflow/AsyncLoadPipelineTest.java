package org.waabox.maskflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.waabox.maskflow.channel.ChannelClosedException;

/**
 * Tests for {@link AsyncLoadPipeline} and {@link BatchStream}, running the
 * load worker on its own thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AsyncLoadPipelineTest {

  /** A study slice used as identifier in these tests. */
  record Slice(String study, int number) {}

  /** A dummy root, the in-memory enumerators ignore it. */
  private static final Path ROOT = Path.of("dataset");

  @Test
  void whenConsuming_givenStubLoader_shouldTraceEveryItemToItsIdentifier() {
    final List<Slice> slices = slices(10);

    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices), StubItemLoader.<Slice>identity())
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(3, 2, EnumerationOptions.ordered()))
        .build();

    final List<Slice> received = new ArrayList<>();
    try (BatchStream<Slice> batches = pipeline.open()) {
      batches.forEachRemaining(batch -> received.addAll(batch.items()));

      assertTrue(batches.isFinished());
      assertEquals(10, batches.report().loaded());
      assertEquals(4, batches.report().batches());
    }

    assertEquals(slices, received);
  }

  @Test
  void whenConsuming_givenSeveralBatches_shouldObserveThemInEnqueueOrder() {
    final List<Slice> slices = slices(25);

    final AsyncLoadPipeline<Slice, String> pipeline = AsyncLoadPipeline
        .builder(fixed(slices), StubItemLoader.<Slice, String>mapping(Slice::toString))
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(2, 1, EnumerationOptions.ordered()))
        .build();

    long expectedSequence = 0;
    try (BatchStream<String> batches = pipeline.open()) {
      while (batches.hasNext()) {
        final Batch<String> batch = batches.next();
        assertEquals(expectedSequence++, batch.sequence());
      }
    }
    assertEquals(13, expectedSequence);
  }

  @Test
  void whenConsuming_givenOneFailingItem_shouldEmitTwoBatchesAndOneSkip() {
    final List<Slice> slices = slices(5);
    final Slice broken = slices.get(2);
    final ItemLoader<Slice, Slice> loader = slice -> {
      if (slice.equals(broken)) {
        throw new IllegalStateException("corrupt DICOM");
      }
      return LoadResult.loaded(slice);
    };

    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices), loader)
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(2, 2, EnumerationOptions.ordered()))
        .build();

    final List<Integer> sizes = new ArrayList<>();
    final LoadReport report;
    try (BatchStream<Slice> batches = pipeline.open()) {
      batches.forEachRemaining(batch -> sizes.add(batch.size()));
      report = batches.report();
    }

    assertEquals(List.of(2, 2), sizes);
    assertEquals(1, report.skipped());
    assertEquals(5, report.enumerated());
  }

  @Test
  void whenConsuming_givenEmptyDataset_shouldEndImmediately() {
    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(List.of()), StubItemLoader.<Slice>identity())
        .datasetRoot(ROOT)
        .build();

    try (BatchStream<Slice> batches = pipeline.open()) {
      assertFalse(batches.hasNext());
      assertFalse(batches.hasNext());
      assertThrows(NoSuchElementException.class, batches::next);
      assertEquals(0, batches.report().batches());
      assertEquals(0, batches.report().skipped());
    }
  }

  @Test
  void whenConsuming_givenAllItemsFailing_shouldReportEverySkip() {
    final List<Slice> slices = slices(6);

    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices),
            (ItemLoader<Slice, Slice>) s -> LoadResult.skipped("empty mask"))
        .datasetRoot(ROOT)
        .config(PipelineConfig.ofBatchSize(4))
        .build();

    try (BatchStream<Slice> batches = pipeline.open()) {
      assertFalse(batches.hasNext());
      assertEquals(6, batches.report().skipped());
      assertEquals(0, batches.report().loaded());
      assertEquals(LoadReport.Status.COMPLETED_WITH_SKIPS,
          batches.report().status());
    }
  }

  @Test
  void whenNotConsuming_givenFullChannel_shouldBlockTheProducer()
      throws Exception {
    final AtomicInteger loads = new AtomicInteger();
    final ItemLoader<Slice, Slice> counting = slice -> {
      loads.incrementAndGet();
      return LoadResult.loaded(slice);
    };

    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices(50)), counting)
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(1, 2, EnumerationOptions.ordered()))
        .build();

    try (BatchStream<Slice> batches = pipeline.open()) {
      // Two batches fit in the channel, the third load waits on put.
      waitUntil(() -> loads.get() >= 3);
      Thread.sleep(200);
      assertEquals(3, loads.get());

      assertTrue(batches.hasNext());
      batches.next();
      waitUntil(() -> loads.get() >= 4);
      Thread.sleep(200);
      assertEquals(4, loads.get());
    }
  }

  @Test
  void whenClosingEarly_givenRunningWorker_shouldStopTheWorkerThread() {
    final AtomicInteger loads = new AtomicInteger();
    final ItemLoader<Slice, Slice> counting = slice -> {
      loads.incrementAndGet();
      return LoadResult.loaded(slice);
    };

    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices(1000)), counting)
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(2, 2, EnumerationOptions.ordered()))
        .workerThreadName("early-close-worker")
        .build();

    final BatchStream<Slice> batches = pipeline.open();
    assertNotNull(batches.next());
    batches.close();

    assertFalse(workerAlive("early-close-worker"));
    assertTrue(loads.get() < 1000);
    assertFalse(batches.hasNext());
    assertThrows(IllegalStateException.class, batches::report);
  }

  @Test
  void whenConsumerIsInterrupted_givenRunningStream_shouldStayFailed() {
    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices(100)), StubItemLoader.<Slice>identity())
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(1, 1, EnumerationOptions.ordered()))
        .workerThreadName("interrupted-consumer-worker")
        .build();

    try (BatchStream<Slice> batches = pipeline.open()) {
      Thread.currentThread().interrupt();
      assertThrows(ChannelClosedException.class, batches::hasNext);
      assertTrue(Thread.interrupted());

      assertThrows(ChannelClosedException.class, batches::hasNext);
      assertFalse(batches.isFinished());
      assertThrows(IllegalStateException.class, batches::report);
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void whenLoaderCrashes_givenErrorEscapingTheBoundary_shouldFailTheStream() {
    final List<Slice> slices = slices(5);
    final ItemLoader<Slice, Slice> loader = slice -> {
      if (slice.number() == 3) {
        throw new SimulatedCrash();
      }
      return LoadResult.loaded(slice);
    };

    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices), loader)
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(1, 4, EnumerationOptions.ordered()))
        .build();

    final List<Slice> received = new ArrayList<>();
    final AtomicReference<ChannelClosedException> failure =
        new AtomicReference<>();
    try (BatchStream<Slice> batches = pipeline.open()) {
      while (batches.hasNext()) {
        received.addAll(batches.next().items());
      }
    } catch (final ChannelClosedException e) {
      failure.set(e);
    }

    assertNotNull(failure.get());
    assertInstanceOf(SimulatedCrash.class, failure.get().getCause());
    assertEquals(slices.subList(0, 2), received);
  }

  @Test
  void whenOpening_givenUnrecognizedDataset_shouldThrowBeforeStarting() {
    final ItemEnumerator<Slice> broken = root -> {
      throw new PipelineConfigurationException("no link.csv under " + root);
    };

    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(broken, StubItemLoader.<Slice>identity())
        .datasetRoot(ROOT)
        .workerThreadName("never-started-worker")
        .build();

    assertThrows(PipelineConfigurationException.class, pipeline::open);
    assertFalse(workerAlive("never-started-worker"));
  }

  @Test
  void whenBuilding_givenNoDatasetRoot_shouldThrow() {
    final AsyncLoadPipeline.Builder<Slice, Slice> builder = AsyncLoadPipeline
        .builder(fixed(List.of()), StubItemLoader.<Slice>identity());

    assertThrows(PipelineConfigurationException.class, builder::build);
  }

  @Test
  void whenBuilding_givenDefaults_shouldUseDefaultConfig() {
    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(List.of()), StubItemLoader.<Slice>identity())
        .datasetRoot(ROOT)
        .build();

    assertEquals(PipelineConfig.DEFAULT_BATCH_SIZE,
        pipeline.config().batchSize());
    assertEquals(PipelineConfig.DEFAULT_QUEUE_CAPACITY,
        pipeline.config().queueCapacity());
    assertEquals(ROOT, pipeline.datasetRoot());
  }

  @Test
  void whenOpeningTwice_givenSamePipeline_shouldRunIndependently() {
    final AsyncLoadPipeline<Slice, Slice> pipeline = AsyncLoadPipeline
        .builder(fixed(slices(4)), StubItemLoader.<Slice>identity())
        .datasetRoot(ROOT)
        .config(PipelineConfig.of(4, 1, EnumerationOptions.shuffled(7)))
        .build();

    final List<Slice> first;
    final List<Slice> second;
    try (BatchStream<Slice> batches = pipeline.open()) {
      first = batches.next().items();
    }
    try (BatchStream<Slice> batches = pipeline.open()) {
      second = batches.next().items();
    }

    assertEquals(first, second);
  }

  /** An error that escapes the per-item boundary. */
  private static final class SimulatedCrash extends Error {
    private static final long serialVersionUID = 1L;
  }

  private static List<Slice> slices(final int count) {
    return IntStream.rangeClosed(1, count)
        .mapToObj(i -> new Slice("SCD0000101", i))
        .collect(Collectors.toList());
  }

  private static ItemEnumerator<Slice> fixed(final List<Slice> slices) {
    return root -> slices;
  }

  private static boolean workerAlive(final String name) {
    return Thread.getAllStackTraces().keySet().stream()
        .anyMatch(t -> t.getName().equals(name) && t.isAlive());
  }

  private static void waitUntil(final BooleanSupplier condition)
      throws InterruptedException {
    final long deadline = System.currentTimeMillis() + 5_000;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("condition not met in time");
      }
      Thread.sleep(10);
    }
  }
}
