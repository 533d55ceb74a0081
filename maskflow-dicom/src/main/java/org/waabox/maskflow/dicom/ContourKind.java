package org.waabox.maskflow.dicom;

import org.waabox.maskflow.PipelineConfigurationException;

/**
 * The kind of manual contour paired with each image.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ContourKind {

  /** Inner (endocardial) contours, under {@code i-contours}. */
  INNER("i-contours"),

  /** Outer (epicardial) contours, under {@code o-contours}. */
  OUTER("o-contours");

  /** The directory holding the contour files of this kind. */
  private final String directoryName;

  ContourKind(final String directoryName) {
    this.directoryName = directoryName;
  }

  /**
   * Returns the name of the directory holding contours of this kind.
   *
   * @return the directory name, never null
   */
  public String directoryName() {
    return directoryName;
  }

  /**
   * Resolves a kind from its directory name.
   *
   * @param value the directory name, {@code i-contours} or
   *              {@code o-contours}, never null
   *
   * @return the contour kind, never null
   *
   * @throws PipelineConfigurationException if the name is unknown
   */
  public static ContourKind fromDirectoryName(final String value) {
    final String name = value.strip();
    for (final ContourKind kind : values()) {
      if (kind.directoryName.equals(name)) {
        return kind;
      }
    }
    throw new PipelineConfigurationException("Unknown contour kind '"
        + value + "', expected i-contours or o-contours");
  }
}
