package org.waabox.maskflow.dicom;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.maskflow.dicom.Contour.Vertex;

/**
 * Tests for {@link ContourParser}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class ContourParserTest {

  @TempDir
  Path dir;

  private final ContourParser parser = new ContourParser();

  @Test
  void whenParsing_givenPointLines_shouldReadVerticesInOrder()
      throws IOException {
    final Path file = write("120.50 137.50\n121.50 137.50\n\n122.00  138.25\n");

    final Contour contour = parser.parse(file);

    assertEquals(3, contour.size());
    assertEquals(new Vertex(120.5, 137.5), contour.vertices().get(0));
    assertEquals(new Vertex(122.0, 138.25), contour.vertices().get(2));
  }

  @Test
  void whenParsing_givenNonNumericToken_shouldReportTheLine()
      throws IOException {
    final Path file = write("1.0 2.0\n3.0 abc\n");

    final ContourFormatException e = assertThrows(
        ContourFormatException.class, () -> parser.parse(file));
    assertTrue(e.getMessage().contains(":2:"));
  }

  @Test
  void whenParsing_givenThreeTokens_shouldThrow() throws IOException {
    final Path file = write("1.0 2.0 3.0\n");

    assertThrows(ContourFormatException.class, () -> parser.parse(file));
  }

  @Test
  void whenParsing_givenNaN_shouldThrow() throws IOException {
    final Path file = write("NaN 2.0\n");

    assertThrows(ContourFormatException.class, () -> parser.parse(file));
  }

  @Test
  void whenParsing_givenEmptyFile_shouldThrow() throws IOException {
    final Path file = write("\n\n");

    assertThrows(ContourFormatException.class, () -> parser.parse(file));
  }

  @Test
  void whenParsing_givenMissingFile_shouldThrowIoException() {
    assertThrows(IOException.class,
        () -> parser.parse(dir.resolve("absent.txt")));
  }

  private Path write(final String content) throws IOException {
    return Files.writeString(dir.resolve("contour.txt"), content);
  }
}
