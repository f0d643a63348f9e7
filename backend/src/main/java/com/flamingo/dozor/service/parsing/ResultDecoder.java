package com.flamingo.dozor.service.parsing;

import com.flamingo.dozor.domain.DecodedLog;
import com.flamingo.dozor.domain.ImageResultRecord;
import com.flamingo.dozor.domain.RunParameters;
import com.flamingo.dozor.service.image.ImageFileNames;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes the per-image result table dozor prints to its log.
 *
 * <p>After a six-line banner every line whose first token is an image number is a result row.
 * Columns are separated by whitespace and {@code |}. Two layouts exist:
 *
 * <ul>
 *   <li>short: number, spot count, average intensity, R-factor, resolution, three unused
 *       columns, main score, spot score, visible resolution
 *   <li>extended: the same four spot columns, five powder Wilson columns, then main score, spot
 *       score and visible resolution
 * </ul>
 *
 * A row is short when it has fewer than eleven tokens or its sixth token is negative. A line
 * starting with {@code h} carries the half-dose time of radiation damage runs.
 *
 * <p>A column that is missing or not numeric leaves its field null and is logged; the row is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultDecoder {

  static final int HEADER_LINES = 6;
  static final int EXTENDED_LAYOUT_MIN_TOKENS = 11;
  static final String SPOT_FILE_FORMAT = "%05d.spot";

  private final MeterRegistry meterRegistry;

  /**
   * Decodes a dozor log.
   *
   * @param output captured standard output of the dozor run
   * @param params parameters the run was started with
   * @param workingDirectory directory dozor ran in, searched for spot files; may be null
   * @return records in log order and the half-dose time if one was reported
   */
  public DecodedLog decode(String output, RunParameters params, Path workingDirectory) {
    String imageTemplate = imageTemplate(params.getNameTemplateImage());
    List<ImageResultRecord> records = new ArrayList<>();
    Double halfDoseTime = null;

    String[] lines = output.split("\n", -1);
    for (int i = HEADER_LINES; i < lines.length; i++) {
      String line = lines[i];
      List<String> tokens = LineTokenizer.tokenize(line.replace('|', ' '));
      if (!tokens.isEmpty() && isDigits(tokens.get(0))) {
        Optional<Integer> imageNumber = imageNumber(tokens.get(0));
        if (imageNumber.isEmpty()) {
          log.warn("Line {}: image number {} out of range, line skipped", i + 1, tokens.get(0));
          meterRegistry.counter("dozor.decode.field_errors").increment();
          continue;
        }
        records.add(decodeRow(imageNumber.get(), tokens, params, imageTemplate, workingDirectory));
      } else if (line.startsWith("h")) {
        halfDoseTime = decodeHalfDoseTime(line);
      }
    }

    log.debug("Decoded {} result rows, halfDoseTime={}", records.size(), halfDoseTime);
    return new DecodedLog(records, halfDoseTime);
  }

  /** Rotation angle at the middle of an image. */
  public static double angle(RunParameters params, int imageNumber) {
    double oscillationRange = params.getOscillationRange();
    return params.getStartingAngle()
        + (imageNumber - params.getFirstImageNumber())
            * (oscillationRange - params.getOverlap())
        + oscillationRange / 2.0;
  }

  private ImageResultRecord decodeRow(
      int imageNumber,
      List<String> tokens,
      RunParameters params,
      String imageTemplate,
      Path workingDirectory) {
    ImageResultRecord.ImageResultRecordBuilder builder =
        ImageResultRecord.builder()
            .number(imageNumber)
            .image(ImageFileNames.formatQuestionMarkTemplate(imageTemplate, imageNumber))
            .angle(angle(params, imageNumber))
            .spotsNumOf(parseInt(tokens, 1, imageNumber).orElse(null))
            .spotsIntAver(parseDouble(tokens, 2, imageNumber).orElse(null))
            .spotsRFactor(parseDouble(tokens, 3, imageNumber).orElse(null))
            .spotsResolution(parseDouble(tokens, 4, imageNumber).orElse(null));

    int scoreColumn;
    if (isShortLayout(tokens)) {
      scoreColumn = 8;
    } else {
      builder
          .powderWilsonScale(parseDouble(tokens, 5, imageNumber).orElse(null))
          .powderWilsonBfactor(parseDouble(tokens, 6, imageNumber).orElse(null))
          .powderWilsonResolution(parseDouble(tokens, 7, imageNumber).orElse(null))
          .powderWilsonCorrelation(parseDouble(tokens, 8, imageNumber).orElse(null))
          .powderWilsonRfactor(parseDouble(tokens, 9, imageNumber).orElse(null));
      scoreColumn = 10;
    }
    builder
        .mainScore(parseDouble(tokens, scoreColumn, imageNumber).orElse(null))
        .spotScore(parseDouble(tokens, scoreColumn + 1, imageNumber).orElse(null));
    int visibleResolutionColumn = scoreColumn + 2;
    if (visibleResolutionColumn < tokens.size()) {
      builder.visibleResolution(
          parseDouble(tokens, visibleResolutionColumn, imageNumber).orElse(null));
    }

    if (workingDirectory != null) {
      Path spotFile =
          workingDirectory.resolve(String.format(Locale.ROOT, SPOT_FILE_FORMAT, imageNumber));
      if (Files.exists(spotFile)) {
        builder.spotFile(spotFile.toString());
      }
    }
    return builder.build();
  }

  static boolean isShortLayout(List<String> tokens) {
    return tokens.size() < EXTENDED_LAYOUT_MIN_TOKENS || tokens.get(5).startsWith("-");
  }

  private Double decodeHalfDoseTime(String line) {
    int equals = line.indexOf('=');
    if (equals < 0) {
      log.warn("Half-dose line without value: {}", line);
      return null;
    }
    String[] parts = line.substring(equals + 1).trim().split("\\s+");
    try {
      return Double.parseDouble(parts[0]);
    } catch (NumberFormatException e) {
      log.warn("Half-dose time is not numeric: {}", line);
      return null;
    }
  }

  /**
   * dozor writes the HDF5 template as {@code prefix_1_??????.h5}; the data file numbering is the
   * plain image number.
   */
  private static String imageTemplate(String nameTemplate) {
    if (nameTemplate.endsWith(".h5")) {
      return nameTemplate.replace("1_??????", "??????");
    }
    return nameTemplate;
  }

  private Optional<Integer> parseInt(List<String> tokens, int index, int imageNumber) {
    return token(tokens, index, imageNumber)
        .flatMap(
            value -> {
              try {
                return Optional.of(Integer.parseInt(value));
              } catch (NumberFormatException e) {
                fieldError(imageNumber, index, value);
                return Optional.empty();
              }
            });
  }

  private Optional<Double> parseDouble(List<String> tokens, int index, int imageNumber) {
    return token(tokens, index, imageNumber)
        .flatMap(
            value -> {
              try {
                return Optional.of(Double.parseDouble(value));
              } catch (NumberFormatException e) {
                fieldError(imageNumber, index, value);
                return Optional.empty();
              }
            });
  }

  private Optional<String> token(List<String> tokens, int index, int imageNumber) {
    if (index >= tokens.size()) {
      fieldError(imageNumber, index, null);
      return Optional.empty();
    }
    return Optional.of(tokens.get(index));
  }

  private void fieldError(int imageNumber, int column, String value) {
    meterRegistry.counter("dozor.decode.field_errors").increment();
    if (value == null) {
      log.warn("Image {}: column {} missing in dozor output", imageNumber, column);
    } else {
      log.warn("Image {}: column {} is not numeric: '{}'", imageNumber, column, value);
    }
  }

  private static Optional<Integer> imageNumber(String token) {
    try {
      return Optional.of(Integer.parseInt(token));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private static boolean isDigits(String token) {
    if (token.isEmpty()) {
      return false;
    }
    for (int i = 0; i < token.length(); i++) {
      if (!Character.isDigit(token.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
