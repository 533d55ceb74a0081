package org.waabox.maskflow.dicom;

import java.util.Arrays;
import java.util.Objects;

/**
 * A boolean pixel mask aligned with an image.
 *
 * <p>Stored row-major; the array is defensively copied on construction
 * and on access.
 *
 * @param width  the width in pixels, greater than zero
 * @param height the height in pixels, greater than zero
 * @param pixels the {@code width * height} mask values, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record BinaryMask(int width, int height, boolean[] pixels) {

  /**
   * Validates the dimensions and copies the pixels.
   */
  public BinaryMask {
    Objects.requireNonNull(pixels, "pixels must not be null");
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          "mask dimensions must be positive, got: " + width + "x" + height);
    }
    if (pixels.length != width * height) {
      throw new IllegalArgumentException("expected " + width * height
          + " pixels, got: " + pixels.length);
    }
    pixels = pixels.clone();
  }

  /**
   * Returns a copy of the mask values.
   *
   * @return the row-major mask, never null
   */
  @Override
  public boolean[] pixels() {
    return pixels.clone();
  }

  /**
   * Returns whether a pixel is inside the mask.
   *
   * @param x the column, from 0 to width - 1
   * @param y the row, from 0 to height - 1
   *
   * @return true if the pixel is set
   */
  public boolean isSet(final int x, final int y) {
    Objects.checkIndex(x, width);
    Objects.checkIndex(y, height);
    return pixels[y * width + x];
  }

  /**
   * Returns the number of set pixels.
   *
   * @return the mask area in pixels
   */
  public int count() {
    int count = 0;
    for (final boolean pixel : pixels) {
      if (pixel) {
        count++;
      }
    }
    return count;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BinaryMask)) {
      return false;
    }
    final BinaryMask other = (BinaryMask) o;
    return width == other.width && height == other.height
        && Arrays.equals(pixels, other.pixels);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(width, height) + Arrays.hashCode(pixels);
  }

  @Override
  public String toString() {
    return "BinaryMask[" + width + "x" + height + ", set=" + count() + "]";
  }
}
