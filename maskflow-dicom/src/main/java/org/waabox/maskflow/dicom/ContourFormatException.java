package org.waabox.maskflow.dicom;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a contour file does not hold a list of {@code x y} points.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ContourFormatException extends IOException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for a bad line.
   *
   * @param file       the contour file, never null
   * @param lineNumber the 1-based line number
   * @param message    what is wrong with the line, never null
   */
  public ContourFormatException(final Path file, final int lineNumber,
      final String message) {
    super(file + ":" + lineNumber + ": " + message);
  }

  /**
   * Creates a new exception for the whole file.
   *
   * @param file    the contour file, never null
   * @param message what is wrong with the file, never null
   */
  public ContourFormatException(final Path file, final String message) {
    super(file + ": " + message);
  }
}
