package org.waabox.maskflow.dicom;

import java.util.List;
import java.util.Objects;

/**
 * A closed polygon drawn on an image, in pixel coordinates.
 *
 * @param vertices the polygon vertices in drawing order, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Contour(List<Vertex> vertices) {

  /**
   * One polygon vertex.
   *
   * @param x the column coordinate
   * @param y the row coordinate
   */
  public record Vertex(double x, double y) {
  }

  /**
   * Copies the vertex list.
   */
  public Contour {
    Objects.requireNonNull(vertices, "vertices must not be null");
    vertices = List.copyOf(vertices);
  }

  /**
   * Returns the number of vertices.
   *
   * @return the vertex count
   */
  public int size() {
    return vertices.size();
  }
}
