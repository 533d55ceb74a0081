package org.waabox.maskflow.dicom;

import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.maskflow.ItemLoader;
import org.waabox.maskflow.LoadResult;

/**
 * Loads a DICOM image together with the mask of its manual contour.
 *
 * <p>The image is decoded first, then the contour is parsed and
 * rasterized to the image dimensions. Any failure on the way is returned
 * as a skip; this loader never throws for a bad item:
 * <ul>
 *   <li>the image is missing, unreadable or not a DICOM file,</li>
 *   <li>the contour file is missing or malformed,</li>
 *   <li>the contour has fewer than three vertices,</li>
 *   <li>the contour covers no pixel of the image.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DicomContourLoader
    implements ItemLoader<ImageContourPair, LabeledImage> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DicomContourLoader.class);

  /** The image decoder. */
  private final ImageDecoder decoder;

  /** The contour parser. */
  private final ContourParser parser;

  /** The contour rasterizer. */
  private final MaskRasterizer rasterizer;

  /** Creates a loader that decodes images with ImageJ. */
  public DicomContourLoader() {
    this(new DicomImageDecoder(), new ContourParser(), new MaskRasterizer());
  }

  /**
   * Creates a loader.
   *
   * @param theDecoder    the image decoder, never null
   * @param theParser     the contour parser, never null
   * @param theRasterizer the contour rasterizer, never null
   */
  public DicomContourLoader(final ImageDecoder theDecoder,
      final ContourParser theParser, final MaskRasterizer theRasterizer) {
    decoder = Objects.requireNonNull(theDecoder, "decoder must not be null");
    parser = Objects.requireNonNull(theParser, "parser must not be null");
    rasterizer = Objects.requireNonNull(theRasterizer,
        "rasterizer must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public LoadResult<LabeledImage> load(final ImageContourPair pair) {
    Objects.requireNonNull(pair, "pair must not be null");

    final PixelImage image;
    try {
      image = decoder.decode(pair.imagePath());
    } catch (final IOException | RuntimeException e) {
      return LoadResult.skipped("unreadable image " + pair.imagePath()
          + ": " + e.getMessage(), e);
    }

    final Contour contour;
    try {
      contour = parser.parse(pair.contourPath());
    } catch (final IOException e) {
      return LoadResult.skipped("malformed contour " + pair.contourPath()
          + ": " + e.getMessage(), e);
    }

    final BinaryMask mask;
    try {
      mask = rasterizer.rasterize(contour, image.width(), image.height());
    } catch (final IllegalArgumentException e) {
      return LoadResult.skipped("degenerate contour " + pair.contourPath()
          + ": " + e.getMessage(), e);
    }
    if (mask.count() == 0) {
      return LoadResult.skipped("contour " + pair.contourPath()
          + " covers no pixel of a " + image.width() + "x" + image.height()
          + " image");
    }

    log.debug("Loaded slice {} of {}: mask covers {} pixels",
        pair.sliceNumber(), pair.studyId(), mask.count());
    return LoadResult.loaded(new LabeledImage(pair, image, mask));
  }
}
