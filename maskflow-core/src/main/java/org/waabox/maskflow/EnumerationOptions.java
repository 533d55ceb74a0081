package org.waabox.maskflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Random;

/**
 * Controls the order in which enumerated identifiers are handed to the
 * load worker.
 *
 * <p>Three orders are supported:
 * <ul>
 *   <li>{@link #ordered()} keeps the enumerator's discovery order.</li>
 *   <li>{@link #shuffled(long)} shuffles with a seeded generator, so the
 *       same seed always yields the same order.</li>
 *   <li>{@link #shuffledRandomly()} shuffles with a fresh seed on every
 *       call.</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class EnumerationOptions {

  /** The discovery-order options. */
  private static final EnumerationOptions ORDERED =
      new EnumerationOptions(false, null);

  /** The unseeded shuffle options. */
  private static final EnumerationOptions RANDOM =
      new EnumerationOptions(true, null);

  /** Whether identifiers are shuffled. */
  private final boolean shuffle;

  /** The shuffle seed, null for an unseeded shuffle. */
  private final Long seed;

  /**
   * Creates new options.
   *
   * @param shuffle whether to shuffle
   * @param seed    the seed, may be null
   */
  private EnumerationOptions(final boolean shuffle, final Long seed) {
    this.shuffle = shuffle;
    this.seed = seed;
  }

  /**
   * Returns options that keep the discovery order.
   *
   * @return the ordered options, never null
   */
  public static EnumerationOptions ordered() {
    return ORDERED;
  }

  /**
   * Returns options that shuffle deterministically.
   *
   * @param seed the shuffle seed
   *
   * @return the seeded shuffle options, never null
   */
  public static EnumerationOptions shuffled(final long seed) {
    return new EnumerationOptions(true, seed);
  }

  /**
   * Returns options that shuffle with a new random seed each time.
   *
   * @return the unseeded shuffle options, never null
   */
  public static EnumerationOptions shuffledRandomly() {
    return RANDOM;
  }

  /**
   * Returns whether identifiers are shuffled.
   *
   * @return true if shuffled
   */
  public boolean shuffle() {
    return shuffle;
  }

  /**
   * Returns the shuffle seed.
   *
   * @return the seed, empty when ordered or unseeded
   */
  public OptionalLong seed() {
    return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
  }

  /**
   * Applies these options to a discovered identifier list.
   *
   * @param <I>         the identifier type
   * @param identifiers the identifiers in discovery order, never null
   *
   * @return a new unmodifiable list in the requested order, never null
   */
  public <I> List<I> apply(final List<I> identifiers) {
    Objects.requireNonNull(identifiers, "identifiers must not be null");
    if (!shuffle) {
      return List.copyOf(identifiers);
    }
    final List<I> copy = new ArrayList<>(identifiers);
    final Random random = seed == null ? new Random() : new Random(seed);
    Collections.shuffle(copy, random);
    return Collections.unmodifiableList(copy);
  }

  @Override
  public String toString() {
    if (!shuffle) {
      return "ordered";
    }
    return seed == null ? "shuffled(random)" : "shuffled(seed=" + seed + ")";
  }
}
