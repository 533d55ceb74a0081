package org.waabox.maskflow.dicom;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.maskflow.ItemEnumerator;
import org.waabox.maskflow.PipelineConfigurationException;

/**
 * Enumerates image/contour pairs from a dataset laid out as:
 * <pre>
 * &lt;root&gt;/link.csv
 * &lt;root&gt;/dicoms/&lt;patient_id&gt;/&lt;slice&gt;.dcm
 * &lt;root&gt;/contourfiles/&lt;original_id&gt;/i-contours/IM-0001-&lt;slice&gt;-icontour-manual.txt
 * &lt;root&gt;/contourfiles/&lt;original_id&gt;/o-contours/IM-0001-&lt;slice&gt;-ocontour-manual.txt
 * </pre>
 *
 * <p>{@code link.csv} has a header row followed by one
 * {@code patient_id,original_id} row per study. Only slices that have both
 * a DICOM file and a contour file are yielded, ordered by slice number
 * within a study, studies in {@code link.csv} order. Files whose names do
 * not follow the patterns above are ignored.
 *
 * <p>A missing link file, a malformed row or a missing study directory
 * means the dataset is not what the run was configured for, and fails the
 * whole enumeration with {@link PipelineConfigurationException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LinkFileEnumerator
    implements ItemEnumerator<ImageContourPair> {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(LinkFileEnumerator.class);

  /** The name of the study link file under the root. */
  public static final String LINK_FILE = "link.csv";

  /** The directory holding one DICOM directory per patient. */
  public static final String DICOM_DIR = "dicoms";

  /** The directory holding one contour directory per original study. */
  public static final String CONTOUR_DIR = "contourfiles";

  /** Matches DICOM file names, the group is the slice number. */
  private static final Pattern DICOM_FILE =
      Pattern.compile("^(\\d{1,9})\\.dcm$");

  /** Matches contour file names, the group is the slice number. */
  private static final Pattern CONTOUR_FILE =
      Pattern.compile("^IM-\\d+-(\\d{1,9})-[io]contour-manual\\.txt$");

  /** The kind of contours to pair with the images. */
  private final ContourKind contourKind;

  /** Creates an enumerator for inner contours. */
  public LinkFileEnumerator() {
    this(ContourKind.INNER);
  }

  /**
   * Creates an enumerator.
   *
   * @param theContourKind the kind of contours to pair, never null
   */
  public LinkFileEnumerator(final ContourKind theContourKind) {
    contourKind = Objects.requireNonNull(theContourKind,
        "contourKind must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public List<ImageContourPair> enumerate(final Path datasetRoot) {
    Objects.requireNonNull(datasetRoot, "datasetRoot must not be null");
    requireDirectory(datasetRoot, "dataset root");

    final Path linkFile = datasetRoot.resolve(LINK_FILE);
    if (!Files.isRegularFile(linkFile)) {
      throw new PipelineConfigurationException(
          "Missing link file: " + linkFile);
    }

    final List<ImageContourPair> pairs = new ArrayList<>();
    for (final StudyLink link : readLinks(linkFile)) {
      final List<ImageContourPair> study = pairStudy(datasetRoot, link);
      if (study.isEmpty()) {
        log.warn("Study {} ({}) has no paired slices", link.patientId(),
            link.originalId());
      }
      log.debug("Study {}: {} pairs", link.patientId(), study.size());
      pairs.addAll(study);
    }
    log.info("Found {} image/{} pairs under {}", pairs.size(),
        contourKind.directoryName(), datasetRoot);
    return Collections.unmodifiableList(pairs);
  }

  /**
   * Returns the kind of contours this enumerator pairs.
   *
   * @return the contour kind, never null
   */
  public ContourKind contourKind() {
    return contourKind;
  }

  private List<ImageContourPair> pairStudy(final Path root,
      final StudyLink link) {
    final Path dicomDir = root.resolve(DICOM_DIR).resolve(link.patientId());
    final Path contourDir = root.resolve(CONTOUR_DIR)
        .resolve(link.originalId()).resolve(contourKind.directoryName());
    requireDirectory(dicomDir, "DICOM directory");
    requireDirectory(contourDir, "contour directory");

    final Map<Integer, Path> images = index(dicomDir, DICOM_FILE);
    final Map<Integer, Path> contours = index(contourDir, CONTOUR_FILE);

    final List<ImageContourPair> pairs = new ArrayList<>();
    for (final Map.Entry<Integer, Path> image : images.entrySet()) {
      final Path contour = contours.get(image.getKey());
      if (contour != null) {
        pairs.add(new ImageContourPair(link.patientId(), image.getValue(),
            contour, image.getKey()));
      }
    }
    return pairs;
  }

  /** Maps slice numbers to files, sorted by slice number. */
  private static Map<Integer, Path> index(final Path dir,
      final Pattern pattern) {
    final Map<Integer, Path> files = new TreeMap<>();
    try (Stream<Path> entries = Files.list(dir)) {
      entries.filter(Files::isRegularFile).forEach(file -> {
        final Matcher matcher =
            pattern.matcher(file.getFileName().toString());
        if (matcher.matches()) {
          files.put(Integer.parseInt(matcher.group(1)), file);
        }
      });
    } catch (final IOException e) {
      throw new PipelineConfigurationException(
          "Cannot list directory: " + dir, e);
    }
    return files;
  }

  private static List<StudyLink> readLinks(final Path linkFile) {
    final List<String> lines;
    try {
      lines = Files.readAllLines(linkFile, StandardCharsets.UTF_8);
    } catch (final IOException e) {
      throw new PipelineConfigurationException(
          "Cannot read link file: " + linkFile, e);
    }

    final List<StudyLink> links = new ArrayList<>();
    // first line is the header.
    for (int i = 1; i < lines.size(); i++) {
      final String line = lines.get(i).strip();
      if (line.isEmpty()) {
        continue;
      }
      final String[] columns = line.split(",", -1);
      if (columns.length < 2 || columns[0].isBlank()
          || columns[1].isBlank()) {
        throw new PipelineConfigurationException("Malformed row "
            + (i + 1) + " in " + linkFile + ": '" + line + "'");
      }
      links.add(new StudyLink(columns[0].strip(), columns[1].strip()));
    }
    return links;
  }

  private static void requireDirectory(final Path dir, final String what) {
    if (!Files.isDirectory(dir)) {
      throw new PipelineConfigurationException(
          "Missing " + what + ": " + dir);
    }
  }

  /** One row of the link file. */
  private record StudyLink(String patientId, String originalId) {
  }
}
