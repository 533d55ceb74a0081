package org.waabox.maskflow;

/**
 * Loads and transforms one dataset item.
 *
 * <p>Implementations turn an opaque identifier (for example an image path
 * and an annotation path) into a payload ready for the consumer. Expected
 * per-item failures must be reported as {@link LoadResult#skipped(String)}
 * rather than thrown; the load worker still guards every call, so a loader
 * that throws costs one item, never the run.
 *
 * <p>Production and test implementations share this contract and are
 * chosen once, when the pipeline is built.
 *
 * @param <I> the identifier type
 * @param <T> the payload type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ItemLoader<I, T> {

  /**
   * Loads the item identified by the given identifier.
   *
   * @param identifier the item to load, never null
   *
   * @return the loaded payload or a skip, never null
   */
  LoadResult<T> load(I identifier);
}
