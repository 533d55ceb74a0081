package org.waabox.maskflow;

import java.util.Locale;
import java.util.Objects;

/**
 * Selects which {@link ItemLoader} implementation a run uses.
 *
 * <p>The mode is read from configuration once, when the pipeline is
 * assembled. The load worker never sees it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LoaderMode {

  /** Decode real files from disk. */
  PRODUCTION,

  /** Emit identifiers as payloads without any file I/O. */
  STUB;

  /**
   * Parses a mode name, ignoring case and surrounding blanks.
   *
   * @param value the mode name, never null
   *
   * @return the matching mode, never null
   *
   * @throws PipelineConfigurationException if the name is unknown
   */
  public static LoaderMode parse(final String value) {
    Objects.requireNonNull(value, "value must not be null");
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (final IllegalArgumentException e) {
      throw new PipelineConfigurationException(
          "Unknown loader mode '" + value + "', expected one of: production,"
              + " stub", e);
    }
  }
}
