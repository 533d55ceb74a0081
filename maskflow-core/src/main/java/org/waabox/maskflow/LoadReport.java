package org.waabox.maskflow;

import java.util.List;
import java.util.Objects;

/**
 * End-of-run totals of a pipeline run.
 *
 * <p>For a completed run every enumerated item was attempted exactly once,
 * so {@code enumerated == attempted == loaded + skipped}. The skipped items
 * are listed with the reason each one was dropped.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LoadReport {

  /** How a run that reached its end finished. */
  public enum Status {

    /** Every enumerated item was loaded. */
    COMPLETED,

    /** The run reached its end but some items were skipped. */
    COMPLETED_WITH_SKIPS
  }

  /**
   * An item dropped by the load worker.
   *
   * @param identifier the identifier of the item, as text, never null
   * @param reason     why it was dropped, never null
   */
  public record SkippedItem(String identifier, String reason) {

    /**
     * Validates the components.
     *
     * @param identifier the identifier text, never null
     * @param reason     the reason, never null
     */
    public SkippedItem {
      Objects.requireNonNull(identifier, "identifier must not be null");
      Objects.requireNonNull(reason, "reason must not be null");
    }
  }

  /** The number of identifiers enumerated. */
  private final int enumerated;

  /** The number of payloads emitted in batches. */
  private final int loaded;

  /** The number of batches emitted. */
  private final long batches;

  /** The skipped items, in attempt order. */
  private final List<SkippedItem> skippedItems;

  /**
   * Creates a new report.
   *
   * @param enumerated   the number of identifiers enumerated, never
   *                     negative
   * @param loaded       the number of payloads emitted, never negative
   * @param batches      the number of batches emitted, never negative
   * @param skippedItems the skipped items, never null
   */
  public LoadReport(final int enumerated, final int loaded,
      final long batches, final List<SkippedItem> skippedItems) {
    Objects.requireNonNull(skippedItems, "skippedItems must not be null");
    if (enumerated < 0 || loaded < 0 || batches < 0) {
      throw new IllegalArgumentException("counts must not be negative");
    }
    this.enumerated = enumerated;
    this.loaded = loaded;
    this.batches = batches;
    this.skippedItems = List.copyOf(skippedItems);
  }

  /**
   * Returns the number of identifiers enumerated for the run.
   *
   * @return the enumerated count
   */
  public int enumerated() {
    return enumerated;
  }

  /**
   * Returns the number of items attempted.
   *
   * @return loaded plus skipped
   */
  public int attempted() {
    return loaded + skippedItems.size();
  }

  /**
   * Returns the number of payloads emitted in batches.
   *
   * @return the loaded count
   */
  public int loaded() {
    return loaded;
  }

  /**
   * Returns the number of items skipped.
   *
   * @return the skipped count
   */
  public int skipped() {
    return skippedItems.size();
  }

  /**
   * Returns the number of batches emitted before the sentinel.
   *
   * @return the batch count
   */
  public long batches() {
    return batches;
  }

  /**
   * Returns the skipped items in the order they were attempted.
   *
   * @return an unmodifiable list, never null
   */
  public List<SkippedItem> skippedItems() {
    return skippedItems;
  }

  /**
   * Returns how the run finished.
   *
   * @return the status, never null
   */
  public Status status() {
    return skippedItems.isEmpty()
        ? Status.COMPLETED : Status.COMPLETED_WITH_SKIPS;
  }

  @Override
  public String toString() {
    return "LoadReport[status=" + status()
        + ", enumerated=" + enumerated
        + ", attempted=" + attempted()
        + ", loaded=" + loaded
        + ", skipped=" + skipped()
        + ", batches=" + batches + "]";
  }
}
