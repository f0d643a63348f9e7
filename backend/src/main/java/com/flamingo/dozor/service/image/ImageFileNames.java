package com.flamingo.dozor.service.image;

import com.flamingo.dozor.exception.ConfigurationException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File naming convention of the beamline detectors: {@code <prefix>_<number>.<suffix>}, e.g.
 * {@code mesh-x_1_0042.cbf}. HDF5 data sets use {@code <prefix>_<file number>_master.h5} for the
 * master file.
 */
public final class ImageFileNames {

  private static final Pattern PLACEHOLDER_RUN = Pattern.compile("#+|\\?+");
  private static final Pattern PRINTF_SLOT = Pattern.compile("%0?(\\d*)d");
  private static final String MASTER_SUFFIX = "_master";

  private ImageFileNames() {}

  /** Returns the run number embedded in the file name. */
  public static int getImageNumber(String imagePath) {
    String stem = stem(imagePath);
    int underscore = stem.lastIndexOf('_');
    String token = underscore >= 0 ? stem.substring(underscore + 1) : stem;
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("No image number in file name: " + imagePath, e);
    }
  }

  /** Returns the file name without its image number and extension. */
  public static String getPrefix(String imagePath) {
    String stem = stem(imagePath);
    if (stem.endsWith(MASTER_SUFFIX)) {
      stem = stem.substring(0, stem.length() - MASTER_SUFFIX.length());
    }
    int underscore = stem.lastIndexOf('_');
    return underscore > 0 ? stem.substring(0, underscore) : stem;
  }

  /** Returns the extension without the dot, or an empty string. */
  public static String getSuffix(String imagePath) {
    String fileName = fileName(imagePath);
    int dot = fileName.lastIndexOf('.');
    return dot >= 0 ? fileName.substring(dot + 1) : "";
  }

  public static boolean isHdf5(String imagePath) {
    return imagePath != null && imagePath.endsWith("h5");
  }

  /** HDF5 master file of the data set an image belongs to. */
  public static String getHdf5MasterPath(String imagePath, int fileNumber) {
    Path path = Path.of(imagePath);
    String master = getPrefix(imagePath) + "_" + fileNumber + MASTER_SUFFIX + ".h5";
    Path parent = path.getParent();
    return parent == null ? master : parent.resolve(master).toString();
  }

  /**
   * Replaces the first run of {@code #} or {@code ?} characters by a zero-padded printf slot of
   * the same width.
   *
   * @throws ConfigurationException if the template carries neither a placeholder run nor a printf
   *     slot
   */
  public static String toPrintfTemplate(String template) {
    Matcher matcher = PLACEHOLDER_RUN.matcher(template);
    if (matcher.find()) {
      int width = matcher.end() - matcher.start();
      return template.substring(0, matcher.start())
          + "%0"
          + width
          + "d"
          + template.substring(matcher.end());
    }
    if (PRINTF_SLOT.matcher(template).find()) {
      return template;
    }
    throw new ConfigurationException("Template has no image number placeholder: " + template);
  }

  /** Replaces the run of {@code ?} characters by the zero-padded image number. */
  public static String formatQuestionMarkTemplate(String template, int imageNumber) {
    Matcher matcher = Pattern.compile("\\?+").matcher(template);
    if (!matcher.find()) {
      return template;
    }
    int width = matcher.end() - matcher.start();
    return template.substring(0, matcher.start())
        + String.format(Locale.ROOT, "%0" + width + "d", imageNumber)
        + template.substring(matcher.end());
  }

  /** Shows a printf template with its number slot as {@code ####}. */
  public static String toDisplayTemplate(String printfTemplate) {
    Matcher matcher = PRINTF_SLOT.matcher(printfTemplate);
    if (!matcher.find()) {
      return printfTemplate;
    }
    String widthGroup = matcher.group(1);
    int width = widthGroup.isEmpty() ? 4 : Integer.parseInt(widthGroup);
    return printfTemplate.substring(0, matcher.start())
        + "#".repeat(width)
        + printfTemplate.substring(matcher.end());
  }

  private static String fileName(String imagePath) {
    Path fileName = Path.of(imagePath).getFileName();
    return fileName == null ? imagePath : fileName.toString();
  }

  private static String stem(String imagePath) {
    String fileName = fileName(imagePath);
    int dot = fileName.lastIndexOf('.');
    return dot >= 0 ? fileName.substring(0, dot) : fileName;
  }
}
