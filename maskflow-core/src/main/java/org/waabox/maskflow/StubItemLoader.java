package org.waabox.maskflow;

import java.util.Objects;
import java.util.function.Function;

/**
 * An {@link ItemLoader} that does no I/O.
 *
 * <p>Returns the identifier itself, or a deterministic transform of it, as
 * the loaded payload. This lets the pipeline control flow be exercised and
 * every emitted payload be traced back to its identifier without decoding
 * real files.
 *
 * @param <I> the identifier type
 * @param <T> the payload type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StubItemLoader<I, T> implements ItemLoader<I, T> {

  /** The transform applied to each identifier, never null. */
  private final Function<? super I, ? extends T> transform;

  /**
   * Creates a new stub loader.
   *
   * @param transform the identifier transform, never null
   */
  private StubItemLoader(final Function<? super I, ? extends T> transform) {
    this.transform = transform;
  }

  /**
   * Creates a stub loader whose payload is the identifier itself.
   *
   * @param <I> the identifier type
   *
   * @return a new identity stub loader, never null
   */
  public static <I> StubItemLoader<I, I> identity() {
    return new StubItemLoader<>(Function.identity());
  }

  /**
   * Creates a stub loader that maps each identifier through a function.
   *
   * <p>The function should be deterministic so emitted payloads remain
   * traceable to their identifiers.
   *
   * @param <I>       the identifier type
   * @param <T>       the payload type
   * @param transform the identifier transform, never null
   *
   * @return a new stub loader, never null
   */
  public static <I, T> StubItemLoader<I, T> mapping(
      final Function<? super I, ? extends T> transform) {
    Objects.requireNonNull(transform, "transform must not be null");
    return new StubItemLoader<>(transform);
  }

  /** {@inheritDoc} */
  @Override
  public LoadResult<T> load(final I identifier) {
    Objects.requireNonNull(identifier, "identifier must not be null");
    return LoadResult.loaded(transform.apply(identifier));
  }
}
