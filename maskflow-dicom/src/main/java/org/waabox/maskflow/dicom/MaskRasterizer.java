package org.waabox.maskflow.dicom;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.util.List;
import java.util.Objects;

import org.waabox.maskflow.dicom.Contour.Vertex;

/**
 * Turns a contour into a binary mask the size of its image.
 *
 * <p>The polygon is filled and its outline drawn on an 8-bit gray
 * {@link BufferedImage} with antialiasing off; every painted pixel is
 * part of the mask. Vertices outside the image are clipped, so a contour
 * that lies entirely outside yields an empty mask.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MaskRasterizer {

  /** The smallest number of vertices that encloses an area. */
  static final int MIN_VERTICES = 3;

  /**
   * Rasterizes a contour.
   *
   * @param contour the contour, never null
   * @param width   the mask width, greater than zero
   * @param height  the mask height, greater than zero
   *
   * @return the mask, never null, possibly empty
   *
   * @throws IllegalArgumentException if the contour has fewer than three
   *                                  vertices or a dimension is not positive
   */
  public BinaryMask rasterize(final Contour contour, final int width,
      final int height) {
    Objects.requireNonNull(contour, "contour must not be null");
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          "mask dimensions must be positive, got: " + width + "x" + height);
    }
    if (contour.size() < MIN_VERTICES) {
      throw new IllegalArgumentException("a contour needs at least "
          + MIN_VERTICES + " vertices, got: " + contour.size());
    }

    final BufferedImage canvas =
        new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
    final Graphics2D g2d = canvas.createGraphics();
    try {
      g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING,
          RenderingHints.VALUE_ANTIALIAS_OFF);
      g2d.setColor(Color.WHITE);
      final Path2D polygon = toPath(contour.vertices());
      g2d.fill(polygon);
      g2d.draw(polygon);
    } finally {
      g2d.dispose();
    }

    final Raster raster = canvas.getRaster();
    final boolean[] pixels = new boolean[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        pixels[y * width + x] = raster.getSample(x, y, 0) != 0;
      }
    }
    return new BinaryMask(width, height, pixels);
  }

  private static Path2D toPath(final List<Vertex> vertices) {
    final Path2D path = new Path2D.Double();
    final Vertex first = vertices.get(0);
    path.moveTo(first.x(), first.y());
    for (int i = 1; i < vertices.size(); i++) {
      path.lineTo(vertices.get(i).x(), vertices.get(i).y());
    }
    path.closePath();
    return path;
  }
}
