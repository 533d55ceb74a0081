package org.waabox.maskflow.dicom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.maskflow.dicom.Contour.Vertex;

/**
 * Tests for {@link MaskRasterizer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MaskRasterizerTest {

  private final MaskRasterizer rasterizer = new MaskRasterizer();

  @Test
  void whenRasterizing_givenSquare_shouldFillItsInside() {
    final Contour square = new Contour(List.of(new Vertex(2, 2),
        new Vertex(7, 2), new Vertex(7, 7), new Vertex(2, 7)));

    final BinaryMask mask = rasterizer.rasterize(square, 10, 12);

    assertEquals(10, mask.width());
    assertEquals(12, mask.height());
    assertTrue(mask.isSet(4, 4));
    assertTrue(mask.isSet(3, 6));
    assertFalse(mask.isSet(0, 0));
    assertFalse(mask.isSet(9, 11));
    assertFalse(mask.isSet(9, 4));
    assertTrue(mask.count() >= 25 && mask.count() <= 36,
        "unexpected area " + mask.count());
  }

  @Test
  void whenRasterizing_givenNonSquareImage_shouldUseWidthAsColumns() {
    final Contour wide = new Contour(List.of(new Vertex(10, 1),
        new Vertex(18, 1), new Vertex(18, 3), new Vertex(10, 3)));

    final BinaryMask mask = rasterizer.rasterize(wide, 20, 5);

    assertTrue(mask.isSet(14, 2));
    assertFalse(mask.isSet(2, 2));
  }

  @Test
  void whenRasterizing_givenContourOutsideImage_shouldReturnEmptyMask() {
    final Contour outside = new Contour(List.of(new Vertex(50, 50),
        new Vertex(60, 50), new Vertex(60, 60)));

    assertEquals(0, rasterizer.rasterize(outside, 10, 10).count());
  }

  @Test
  void whenRasterizing_givenTwoVertices_shouldThrow() {
    final Contour line = new Contour(List.of(new Vertex(1, 1),
        new Vertex(5, 5)));

    assertThrows(IllegalArgumentException.class,
        () -> rasterizer.rasterize(line, 10, 10));
  }

  @Test
  void whenRasterizing_givenZeroWidth_shouldThrow() {
    final Contour triangle = new Contour(List.of(new Vertex(1, 1),
        new Vertex(5, 1), new Vertex(3, 4)));

    assertThrows(IllegalArgumentException.class,
        () -> rasterizer.rasterize(triangle, 0, 10));
  }
}
