package org.waabox.maskflow.dicom;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

import ij.IJ;
import ij.Prefs;
import ij.io.FileInfo;
import ij.plugin.DICOM;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import ij.util.DicomTools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes DICOM files with ImageJ.
 *
 * <p>ImageJ only reads the stored pixel values here. The modality rescale
 * is applied by this class from the Rescale Slope (0028,1053) and Rescale
 * Intercept (0028,1052) tags, so the returned values are
 * {@code stored * slope + intercept} (for CT, Hounsfield units). ImageJ's
 * own rescale converts the image through its command interface, which
 * needs the ImageJ menus and fails in a headless JVM, so it is turned off.
 *
 * <p>ImageJ stores signed 16-bit pixels shifted by 32768; the shift is
 * undone before rescaling. Only the first frame of multi-frame files is
 * read.
 *
 * <p>ImageJ reports decoding problems through its own error channel rather
 * than by throwing; those are redirected to the log window, and a file
 * that yields no pixels is reported as an {@link IOException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DicomImageDecoder implements ImageDecoder {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DicomImageDecoder.class);

  /** The Rescale Intercept tag. */
  static final String RESCALE_INTERCEPT = "0028,1052";

  /** The Rescale Slope tag. */
  static final String RESCALE_SLOPE = "0028,1053";

  /** The shift ImageJ adds to signed 16-bit pixels. */
  private static final int SIGNED_16_OFFSET = 32768;

  static {
    Prefs.ignoreRescaleSlope = true;
    Prefs.openDicomsAsFloat = false;
  }

  /** {@inheritDoc} */
  @Override
  public PixelImage decode(final Path file) throws IOException {
    Objects.requireNonNull(file, "file must not be null");
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString());
    }
    if (!Files.isReadable(file)) {
      throw new IOException("DICOM file is not readable: " + file);
    }

    final DICOM dicom = new DICOM();
    IJ.redirectErrorMessages();
    dicom.open(file.toString());

    if (dicom.getWidth() == 0 || dicom.getProcessor() == null) {
      throw new IOException("Not a decodable DICOM file: " + file);
    }

    final double slope = tagValue(dicom, RESCALE_SLOPE, 1.0, file);
    final double intercept = tagValue(dicom, RESCALE_INTERCEPT, 0.0, file);

    final ImageProcessor processor = dicom.getProcessor();
    final boolean integral = processor instanceof ByteProcessor
        || processor instanceof ShortProcessor;
    final FileInfo info = dicom.getOriginalFileInfo();
    final int offset = info != null && info.fileType == FileInfo.GRAY16_SIGNED
        ? SIGNED_16_OFFSET : 0;

    final int width = processor.getWidth();
    final int height = processor.getHeight();
    final float[] pixels = new float[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        if (integral) {
          final int stored = processor.get(x, y) - offset;
          pixels[y * width + x] = (float) (stored * slope + intercept);
        } else {
          pixels[y * width + x] = processor.getPixelValue(x, y);
        }
      }
    }
    log.debug("Decoded {} ({}x{}, slope {}, intercept {})", file, width,
        height, slope, intercept);
    return new PixelImage(width, height, pixels);
  }

  /**
   * Reads a numeric tag of the header.
   *
   * <p>Decimal strings may hold several values separated by a backslash,
   * the first one is used.
   *
   * @param dicom    the opened image, never null
   * @param tag      the tag, as {@code gggg,eeee}, never null
   * @param fallback the value to use when the tag is absent
   * @param file     the file, for error messages, never null
   *
   * @return the tag value, or the fallback
   *
   * @throws IOException if the tag is present but not a number
   */
  private static double tagValue(final DICOM dicom, final String tag,
      final double fallback, final Path file) throws IOException {
    final String value = DicomTools.getTag(dicom, tag);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    final String first = value.split("\\\\")[0].strip();
    try {
      return Double.parseDouble(first);
    } catch (final NumberFormatException e) {
      throw new IOException("Invalid value '" + first + "' for tag " + tag
          + " in " + file, e);
    }
  }
}
