package com.flamingo.dozor.service.plot;

import com.flamingo.dozor.domain.ImageResultRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the per-image quality indicators of a data collection as {@code dozor_<id>.csv} and a
 * {@code gnuplot.sh} script that plots spot count, main score and visible resolution against
 * image number and angle into {@code dozor_<id>.png}.
 */
@Slf4j
@Component
public class QualitySummaryWriter {

  static final String GNUPLOT_SCRIPT = "gnuplot.sh";

  /** Resolution worse than this is ignored when choosing the resolution axis range. */
  private static final double RESOLUTION_CUTOFF = 10.0;

  /**
   * Writes the CSV and, when at least one row is complete, the gnuplot script.
   *
   * @param workingDirectory directory the files are written to
   * @param dataCollectionId id used in the file names
   * @param directory image directory shown in the CSV header
   * @param displayTemplate image file template with the number shown as {@code ####}
   * @param records per-image results
   * @throws UncheckedIOException if a file cannot be written
   */
  public QualitySummary write(
      Path workingDirectory,
      long dataCollectionId,
      String directory,
      String displayTemplate,
      List<ImageResultRecord> records) {
    List<ImageResultRecord> complete =
        records.stream().filter(QualitySummaryWriter::isComplete).toList();
    if (complete.size() < records.size()) {
      log.debug(
          "{} of {} records lack an indicator and are left out of the summary",
          records.size() - complete.size(),
          records.size());
    }

    String csvName = String.format(Locale.ROOT, "dozor_%d.csv", dataCollectionId);
    String plotName = String.format(Locale.ROOT, "dozor_%d.png", dataCollectionId);
    Path csvFile = workingDirectory.resolve(csvName);
    writeFile(csvFile, csv(directory, displayTemplate, complete));

    if (complete.isEmpty()) {
      log.warn("No complete quality indicators for data collection {}", dataCollectionId);
      return new QualitySummary(csvFile, null, null);
    }
    Path script = workingDirectory.resolve(GNUPLOT_SCRIPT);
    writeFile(
        script, gnuplotScript(displayTemplate, plotName, csvName, plotParameters(complete)));
    log.info("Wrote quality summary {} ({} images)", csvFile, complete.size());
    return new QualitySummary(csvFile, script, workingDirectory.resolve(plotName));
  }

  String csv(String directory, String displayTemplate, List<ImageResultRecord> records) {
    StringBuilder csv = new StringBuilder();
    csv.append("# Data directory: ").append(directory).append('\n');
    csv.append("# File template: ").append(displayTemplate).append('\n');
    csv.append(
        String.format(
            Locale.ROOT,
            "# %9s%16s%16s%16s%16s%16s\n",
            "'Image no'",
            "'Angle'",
            "'No of spots'",
            "'Main score (*10)'",
            "'Spot score'",
            "'Visible res.'"));
    for (ImageResultRecord record : records) {
      csv.append(
          String.format(
              Locale.ROOT,
              "%10d,%15.3f,%15d,%15.3f,%15.3f,%15.3f\n",
              record.getNumber(),
              record.getAngle(),
              record.getSpotsNumOf(),
              10 * record.getMainScore(),
              record.getSpotScore(),
              record.getVisibleResolution()));
    }
    return csv.toString();
  }

  /**
   * Axis ranges of the summary plot.
   *
   * @param records complete records, at least one
   */
  PlotParameters plotParameters(List<ImageResultRecord> records) {
    ImageResultRecord first = records.get(0);
    int minImageNumber = first.getNumber();
    int maxImageNumber = first.getNumber();
    double minAngle = first.getAngle();
    double maxAngle = first.getAngle();
    double minScore = first.getMainScore();
    double maxScore = first.getMainScore();
    Double minResolution = null;
    Double maxResolution = null;

    for (ImageResultRecord record : records) {
      if (record.getNumber() < minImageNumber) {
        minImageNumber = record.getNumber();
        minAngle = record.getAngle();
      }
      if (record.getNumber() > maxImageNumber) {
        maxImageNumber = record.getNumber();
        maxAngle = record.getAngle();
      }
      minScore = Math.min(minScore, record.getMainScore());
      maxScore = Math.max(maxScore, record.getMainScore());
      double resolution = record.getVisibleResolution();
      if (resolution < RESOLUTION_CUTOFF && (minResolution == null || resolution > minResolution)) {
        minResolution = resolution;
      }
      if (maxResolution == null || resolution < maxResolution) {
        maxResolution = resolution;
      }
    }

    double imageAxisMin = minImageNumber;
    double imageAxisMax = maxImageNumber;
    String xtics = "";
    if (minImageNumber == maxImageNumber) {
      minAngle -= 1.0;
      maxAngle += 1.0;
    }
    int numberOfImages = maxImageNumber - minImageNumber + 1;
    if (numberOfImages <= 4) {
      imageAxisMin -= 0.1;
      imageAxisMax += 0.1;
      double deltaAngle = maxAngle - minAngle;
      minAngle -= deltaAngle * 0.1 / numberOfImages;
      maxAngle += deltaAngle * 0.1 / numberOfImages;
      xtics = "1";
    }

    double resolutionAxisMax =
        maxResolution == null || maxResolution > 0.8 ? 0.8 : truncateToTenth(maxResolution);
    double resolutionAxisMin =
        minResolution == null || minResolution < 4.5 ? 4.5 : truncateToTenth(minResolution) + 1;

    String yscale =
        maxScore < 0.001 && minScore < 0.001
            ? "set yrange [-0.5:0.5]\n    set ytics 1"
            : "set autoscale  y";

    return new PlotParameters(
        xtics,
        yscale,
        imageAxisMin,
        imageAxisMax,
        minAngle,
        maxAngle,
        minScore,
        maxScore,
        resolutionAxisMin,
        resolutionAxisMax);
  }

  String gnuplotScript(
      String title, String plotFileName, String csvFileName, PlotParameters parameters) {
    return "#\n"
        + "set terminal png\n"
        + "set output '" + plotFileName + "'\n"
        + "set title '" + title + "'\n"
        + "set grid x2 y2\n"
        + "set xlabel 'Image number'\n"
        + "set x2label 'Angle (degrees)'\n"
        + "set y2label 'Resolution (A)'\n"
        + "set ylabel 'Number of spots / ExecDozor score (*10)'\n"
        + "set xtics " + parameters.xtics() + " nomirror\n"
        + "set x2tics\n"
        + "set ytics nomirror\n"
        + "set y2tics\n"
        + "set xrange [" + number(parameters.minImageNumber()) + ":"
        + number(parameters.maxImageNumber()) + "]\n"
        + "set x2range [" + number(parameters.minAngle()) + ":"
        + number(parameters.maxAngle()) + "]\n"
        + parameters.yscale() + "\n"
        + "set y2range [" + number(parameters.minResolution()) + ":"
        + number(parameters.maxResolution()) + "]\n"
        + "set key below\n"
        + "plot '" + csvFileName + "' using 1:3 title 'Number of spots' axes x1y1 with points"
        + " linetype rgb 'goldenrod' pointtype 7 pointsize 1.5, \\\n"
        + "    '" + csvFileName + "' using 1:4 title 'ExecDozor score' axes x1y1 with points"
        + " linetype 3 pointtype 7 pointsize 1.5, \\\n"
        + "    '" + csvFileName + "' using 1:6 title 'Visible resolution' axes x1y2 with points"
        + " linetype 1 pointtype 7 pointsize 1.5\n";
  }

  private static boolean isComplete(ImageResultRecord record) {
    return record.getSpotsNumOf() != null
        && record.getMainScore() != null
        && record.getSpotScore() != null
        && record.getVisibleResolution() != null;
  }

  private static double truncateToTenth(double value) {
    return (int) (value * 10.0) / 10.0;
  }

  private static String number(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }

  private static void writeFile(Path file, String content) {
    try {
      Files.createDirectories(file.getParent());
      Files.writeString(file, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write " + file, e);
    }
  }
}
