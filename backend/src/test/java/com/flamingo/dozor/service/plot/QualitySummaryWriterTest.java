package com.flamingo.dozor.service.plot;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.dozor.domain.ImageResultRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("QualitySummaryWriter Tests")
class QualitySummaryWriterTest {

  private final QualitySummaryWriter writer = new QualitySummaryWriter();

  private static ImageResultRecord record(
      int number, double angle, double mainScore, double visibleResolution) {
    return ImageResultRecord.builder()
        .number(number)
        .angle(angle)
        .spotsNumOf(5)
        .mainScore(mainScore)
        .spotScore(5.0)
        .visibleResolution(visibleResolution)
        .build();
  }

  @Test
  @DisplayName("Should write a header and one fixed-width row per image")
  void shouldFormatCsv() {
    String csv = writer.csv("/data", "mesh_1_####.cbf", List.of(record(1, 0.05, 0.5, 3.0)));

    assertThat(csv)
        .isEqualTo(
            "# Data directory: /data\n"
                + "# File template: mesh_1_####.cbf\n"
                + "# 'Image no'         'Angle'   'No of spots''Main score (*10)'"
                + "    'Spot score'  'Visible res.'\n"
                + "         1,          0.050,              5,          5.000,"
                + "          5.000,          3.000\n");
  }

  @Nested
  @DisplayName("Plot parameters")
  class Parameters {

    @Test
    @DisplayName("Should pad the axes of short runs and derive the resolution range")
    void shouldComputeRangesForShortRun() {
      PlotParameters parameters =
          writer.plotParameters(
              List.of(
                  record(1, 0.05, 0.5, 6.0),
                  record(2, 0.15, 1.0, 0.7),
                  record(3, 0.25, 0.2, 12.0)));

      assertThat(parameters.xtics()).isEqualTo("1");
      assertThat(parameters.minImageNumber()).isCloseTo(0.9, within(1e-9));
      assertThat(parameters.maxImageNumber()).isCloseTo(3.1, within(1e-9));
      assertThat(parameters.minAngle()).isCloseTo(0.05 - 0.02 / 3, within(1e-9));
      assertThat(parameters.maxAngle()).isCloseTo(0.25 + 0.02 / 3, within(1e-9));
      assertThat(parameters.minScore()).isEqualTo(0.2);
      assertThat(parameters.maxScore()).isEqualTo(1.0);
      assertThat(parameters.minResolution()).isCloseTo(7.0, within(1e-9));
      assertThat(parameters.maxResolution()).isCloseTo(0.7, within(1e-9));
      assertThat(parameters.yscale()).isEqualTo("set autoscale  y");
    }

    @Test
    @DisplayName("Should fix the score axis when every score is zero")
    void shouldFixScoreAxisForZeroScores() {
      List<ImageResultRecord> records = new ArrayList<>();
      for (int n = 1; n <= 10; n++) {
        records.add(record(n, n * 0.1, 0.0, 3.0));
      }

      PlotParameters parameters = writer.plotParameters(records);

      assertThat(parameters.xtics()).isEmpty();
      assertThat(parameters.minImageNumber()).isEqualTo(1.0);
      assertThat(parameters.yscale()).isEqualTo("set yrange [-0.5:0.5]\n    set ytics 1");
      assertThat(parameters.minResolution()).isEqualTo(4.5);
      assertThat(parameters.maxResolution()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Should widen the angle axis around a single image")
    void shouldWidenSingleImageAngle() {
      PlotParameters parameters = writer.plotParameters(List.of(record(5, 10.0, 0.5, 3.0)));

      assertThat(parameters.minAngle()).isCloseTo(9.0 - 0.2, within(1e-9));
      assertThat(parameters.maxAngle()).isCloseTo(11.0 + 0.2, within(1e-9));
    }
  }

  @Test
  @DisplayName("Should render plain numbers into the gnuplot script")
  void shouldWriteGnuplotScript() {
    PlotParameters parameters =
        new PlotParameters("1", "set autoscale  y", 0.9, 3.1, 0.0, 1.5, 0.2, 1.0, 4.5, 0.8);

    String script =
        writer.gnuplotScript("mesh_1_####.cbf", "dozor_42.png", "dozor_42.csv", parameters);

    assertThat(script)
        .startsWith("#\nset terminal png\nset output 'dozor_42.png'\nset title 'mesh_1_####.cbf'\n")
        .contains("set xtics 1 nomirror\n")
        .contains("set xrange [0.9:3.1]\nset x2range [0:1.5]\nset autoscale  y\n")
        .contains("set y2range [4.5:0.8]\n")
        .contains("plot 'dozor_42.csv' using 1:3 title 'Number of spots'")
        .endsWith(
            "using 1:6 title 'Visible resolution' axes x1y2 with points"
                + " linetype 1 pointtype 7 pointsize 1.5\n");
  }

  @Test
  @DisplayName("Should leave incomplete records out and write the script")
  void shouldWriteFiles(@TempDir Path dir) throws IOException {
    ImageResultRecord incomplete =
        ImageResultRecord.builder().number(2).angle(0.15).mainScore(0.3).build();

    QualitySummary summary =
        writer.write(
            dir.resolve("run"),
            42L,
            "/data",
            "mesh_1_####.cbf",
            List.of(record(1, 0.05, 0.5, 3.0), incomplete));

    assertThat(summary.csvFile()).isEqualTo(dir.resolve("run/dozor_42.csv"));
    assertThat(Files.readAllLines(summary.csvFile())).hasSize(4);
    assertThat(summary.gnuplotScript()).isEqualTo(dir.resolve("run/gnuplot.sh"));
    assertThat(summary.plotFile()).isEqualTo(dir.resolve("run/dozor_42.png"));
    assertThat(Files.readString(summary.gnuplotScript())).contains("'dozor_42.csv'");
  }

  @Test
  @DisplayName("Should write only the CSV when no record is complete")
  void shouldSkipScriptWithoutCompleteRecords(@TempDir Path dir) {
    ImageResultRecord incomplete = ImageResultRecord.builder().number(1).build();

    QualitySummary summary = writer.write(dir, 7L, "/data", "m_####.cbf", List.of(incomplete));

    assertThat(summary.csvFile()).exists();
    assertThat(summary.script()).isEmpty();
    assertThat(summary.plotFile()).isNull();
  }
}
