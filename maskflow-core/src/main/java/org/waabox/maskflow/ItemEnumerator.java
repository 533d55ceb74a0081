package org.waabox.maskflow;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Discovers every loadable item of a dataset.
 *
 * <p>Enumeration runs once per pipeline run, before the load worker starts,
 * and spans the whole dataset rather than one study at a time, so that
 * shuffling draws from the full corpus.
 *
 * <p>An unrecognized dataset structure is the one fatal error of the
 * loading path: it means the run is misconfigured, not that one file is
 * bad.
 *
 * @param <I> the identifier type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ItemEnumerator<I> {

  /**
   * Lists the identifiers of all loadable items in discovery order.
   *
   * @param datasetRoot the dataset root directory, never null
   *
   * @return the identifiers, never null, may be empty
   *
   * @throws PipelineConfigurationException if the structure under the root
   *                                        is not recognized
   */
  List<I> enumerate(Path datasetRoot);

  /**
   * Lists the identifiers of all loadable items in the order requested by
   * the given options.
   *
   * @param datasetRoot the dataset root directory, never null
   * @param options     the ordering options, never null
   *
   * @return an unmodifiable list of identifiers, never null
   *
   * @throws PipelineConfigurationException if the structure under the root
   *                                        is not recognized
   */
  default List<I> enumerate(final Path datasetRoot,
      final EnumerationOptions options) {
    Objects.requireNonNull(datasetRoot, "datasetRoot must not be null");
    Objects.requireNonNull(options, "options must not be null");
    return options.apply(enumerate(datasetRoot));
  }
}
