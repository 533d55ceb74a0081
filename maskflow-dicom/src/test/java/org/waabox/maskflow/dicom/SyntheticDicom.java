package org.waabox.maskflow.dicom;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.IntBinaryOperator;

/**
 * Writes minimal 16-bit unsigned monochrome DICOM files, explicit VR
 * little endian, for decoder tests.
 *
 * <p>Stored pixel values come from a function of the column and row.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class SyntheticDicom {

  private static final String EXPLICIT_VR_LITTLE_ENDIAN =
      "1.2.840.10008.1.2.1";

  private final int columns;

  private final int rows;

  private final IntBinaryOperator storedValue;

  private Double slope;

  private Double intercept;

  private SyntheticDicom(final int theColumns, final int theRows,
      final IntBinaryOperator theStoredValue) {
    columns = theColumns;
    rows = theRows;
    storedValue = theStoredValue;
  }

  /**
   * Creates an image whose stored value at (x, y) is
   * {@code y * columns + x}.
   */
  static SyntheticDicom ramp(final int columns, final int rows) {
    return new SyntheticDicom(columns, rows, (x, y) -> y * columns + x);
  }

  /** Adds the Rescale Slope and Rescale Intercept tags. */
  SyntheticDicom rescale(final double theSlope, final double theIntercept) {
    slope = theSlope;
    intercept = theIntercept;
    return this;
  }

  int storedValue(final int x, final int y) {
    return storedValue.applyAsInt(x, y);
  }

  Path write(final Path file) throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(new byte[128]);
    out.write("DICM".getBytes(StandardCharsets.US_ASCII));

    element(out, 0x0002, 0x0010, "UI", text(EXPLICIT_VR_LITTLE_ENDIAN, '\0'));
    element(out, 0x0028, 0x0002, "US", uint16(1));
    element(out, 0x0028, 0x0004, "CS", text("MONOCHROME2", ' '));
    element(out, 0x0028, 0x0010, "US", uint16(rows));
    element(out, 0x0028, 0x0011, "US", uint16(columns));
    element(out, 0x0028, 0x0100, "US", uint16(16));
    element(out, 0x0028, 0x0101, "US", uint16(16));
    element(out, 0x0028, 0x0102, "US", uint16(15));
    element(out, 0x0028, 0x0103, "US", uint16(0));
    if (slope != null) {
      element(out, 0x0028, 0x1052, "DS", text(decimal(intercept), ' '));
      element(out, 0x0028, 0x1053, "DS", text(decimal(slope), ' '));
    }

    final ByteBuffer pixels = ByteBuffer.allocate(columns * rows * 2)
        .order(ByteOrder.LITTLE_ENDIAN);
    for (int y = 0; y < rows; y++) {
      for (int x = 0; x < columns; x++) {
        pixels.putShort((short) storedValue(x, y));
      }
    }
    final ByteBuffer header = ByteBuffer.allocate(12)
        .order(ByteOrder.LITTLE_ENDIAN);
    header.putShort((short) 0x7FE0).putShort((short) 0x0010);
    header.put("OW".getBytes(StandardCharsets.US_ASCII));
    header.putShort((short) 0);
    header.putInt(pixels.capacity());
    out.write(header.array());
    out.write(pixels.array());

    return Files.write(file, out.toByteArray());
  }

  private static void element(final ByteArrayOutputStream out,
      final int group, final int element, final String vr,
      final byte[] value) throws IOException {
    final ByteBuffer header = ByteBuffer.allocate(8)
        .order(ByteOrder.LITTLE_ENDIAN);
    header.putShort((short) group).putShort((short) element);
    header.put(vr.getBytes(StandardCharsets.US_ASCII));
    header.putShort((short) value.length);
    out.write(header.array());
    out.write(value);
  }

  private static byte[] uint16(final int value) {
    return ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN)
        .putShort((short) value).array();
  }

  /** Values must have an even length, padded as DICOM requires. */
  private static byte[] text(final String value, final char padding) {
    final String even = value.length() % 2 == 0 ? value : value + padding;
    return even.getBytes(StandardCharsets.US_ASCII);
  }

  private static String decimal(final double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
