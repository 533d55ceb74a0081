package org.waabox.maskflow.dicom;

import java.util.Arrays;
import java.util.Objects;

/**
 * A decoded single-channel image.
 *
 * <p>Pixel values are the calibrated values of the source (for DICOM,
 * after rescale slope and intercept), stored row-major. The array is
 * defensively copied on construction and on access.
 *
 * @param width  the width in pixels, greater than zero
 * @param height the height in pixels, greater than zero
 * @param pixels the {@code width * height} pixel values, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PixelImage(int width, int height, float[] pixels) {

  /**
   * Validates the dimensions and copies the pixels.
   */
  public PixelImage {
    Objects.requireNonNull(pixels, "pixels must not be null");
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          "image dimensions must be positive, got: " + width + "x" + height);
    }
    if (pixels.length != width * height) {
      throw new IllegalArgumentException("expected " + width * height
          + " pixels, got: " + pixels.length);
    }
    pixels = pixels.clone();
  }

  /**
   * Returns a copy of the pixel values.
   *
   * @return the row-major pixels, never null
   */
  @Override
  public float[] pixels() {
    return pixels.clone();
  }

  /**
   * Returns one pixel value.
   *
   * @param x the column, from 0 to width - 1
   * @param y the row, from 0 to height - 1
   *
   * @return the pixel value
   */
  public float pixel(final int x, final int y) {
    Objects.checkIndex(x, width);
    Objects.checkIndex(y, height);
    return pixels[y * width + x];
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PixelImage)) {
      return false;
    }
    final PixelImage other = (PixelImage) o;
    return width == other.width && height == other.height
        && Arrays.equals(pixels, other.pixels);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(width, height) + Arrays.hashCode(pixels);
  }

  @Override
  public String toString() {
    return "PixelImage[" + width + "x" + height + "]";
  }
}
