package org.waabox.maskflow.dicom;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies one loadable slice: a DICOM image and the manual contour
 * drawn on it.
 *
 * @param studyId     the patient study the slice belongs to, never null
 * @param imagePath   the DICOM file, never null
 * @param contourPath the contour text file, never null
 * @param sliceNumber the slice number shared by both file names
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ImageContourPair(
    String studyId,
    Path imagePath,
    Path contourPath,
    int sliceNumber
) {

  /**
   * Validates the components.
   */
  public ImageContourPair {
    Objects.requireNonNull(studyId, "studyId must not be null");
    Objects.requireNonNull(imagePath, "imagePath must not be null");
    Objects.requireNonNull(contourPath, "contourPath must not be null");
  }
}
