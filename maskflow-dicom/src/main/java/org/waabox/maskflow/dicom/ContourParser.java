package org.waabox.maskflow.dicom;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.waabox.maskflow.dicom.Contour.Vertex;

/**
 * Reads manual contour files.
 *
 * <p>Each non-blank line holds the {@code x} and {@code y} pixel
 * coordinates of one vertex, as decimals separated by whitespace, e.g.
 * {@code 120.50 137.50}. Any other content makes the whole file
 * malformed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ContourParser {

  /**
   * Parses a contour file.
   *
   * @param file the contour file, never null
   *
   * @return the contour, with at least one vertex, never null
   *
   * @throws ContourFormatException if a line is not a pair of finite
   *                                decimals or the file has no vertices
   * @throws IOException            if the file cannot be read
   */
  public Contour parse(final Path file) throws IOException {
    Objects.requireNonNull(file, "file must not be null");

    final List<Vertex> vertices = new ArrayList<>();
    try (BufferedReader reader =
        Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        final String trimmed = line.strip();
        if (trimmed.isEmpty()) {
          continue;
        }
        vertices.add(parseVertex(file, lineNumber, trimmed));
      }
    }
    if (vertices.isEmpty()) {
      throw new ContourFormatException(file, "no vertices");
    }
    return new Contour(vertices);
  }

  private static Vertex parseVertex(final Path file, final int lineNumber,
      final String line) throws ContourFormatException {
    final String[] tokens = line.split("\\s+");
    if (tokens.length != 2) {
      throw new ContourFormatException(file, lineNumber,
          "expected 2 coordinates, got " + tokens.length);
    }
    return new Vertex(coordinate(file, lineNumber, tokens[0]),
        coordinate(file, lineNumber, tokens[1]));
  }

  private static double coordinate(final Path file, final int lineNumber,
      final String token) throws ContourFormatException {
    final double value;
    try {
      value = Double.parseDouble(token);
    } catch (final NumberFormatException e) {
      throw new ContourFormatException(file, lineNumber,
          "not a number: '" + token + "'");
    }
    if (!Double.isFinite(value)) {
      throw new ContourFormatException(file, lineNumber,
          "not a finite number: '" + token + "'");
    }
    return value;
  }
}
