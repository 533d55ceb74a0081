package org.waabox.maskflow.dicom;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes an image file into calibrated pixel values.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ImageDecoder {

  /**
   * Decodes the given file.
   *
   * @param file the image file, never null
   *
   * @return the decoded image, never null
   *
   * @throws IOException if the file cannot be read or is not a decodable
   *                     image
   */
  PixelImage decode(Path file) throws IOException;
}
