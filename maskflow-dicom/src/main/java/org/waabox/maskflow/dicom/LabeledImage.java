package org.waabox.maskflow.dicom;

import java.util.Objects;

/**
 * A decoded image together with its contour mask; the payload the DICOM
 * loader hands to the consumer.
 *
 * <p>Image and mask always travel together so they can never get out of
 * alignment downstream.
 *
 * @param source the slice this was loaded from, never null
 * @param image  the decoded image, never null
 * @param mask   the mask, same dimensions as the image, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record LabeledImage(
    ImageContourPair source,
    PixelImage image,
    BinaryMask mask
) {

  /**
   * Validates that image and mask are aligned.
   */
  public LabeledImage {
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(image, "image must not be null");
    Objects.requireNonNull(mask, "mask must not be null");
    if (image.width() != mask.width() || image.height() != mask.height()) {
      throw new IllegalArgumentException("mask " + mask.width() + "x"
          + mask.height() + " does not match image " + image.width() + "x"
          + image.height());
    }
  }
}
