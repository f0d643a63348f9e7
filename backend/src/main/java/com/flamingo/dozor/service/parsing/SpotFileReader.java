package com.flamingo.dozor.service.parsing;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Loads a dozor spot file as a table of numbers, one row per spot. */
@Slf4j
@Component
public class SpotFileReader {

  static final int HEADER_LINES = 3;

  /**
   * Reads a spot file.
   *
   * @param spotFile path of a {@code <number>.spot} file
   * @return spot rows; empty when the file cannot be read
   */
  public double[][] read(Path spotFile) {
    List<String> lines;
    try {
      lines = Files.readAllLines(spotFile, StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.warn("Could not read spot file {}: {}", spotFile, e.getMessage());
      return new double[0][];
    }

    List<double[]> rows = new ArrayList<>();
    for (int i = HEADER_LINES; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      if (line.isEmpty()) {
        continue;
      }
      String[] tokens = line.split("\\s+");
      double[] row = new double[tokens.length];
      try {
        for (int column = 0; column < tokens.length; column++) {
          row[column] = Double.parseDouble(tokens[column]);
        }
      } catch (NumberFormatException e) {
        log.warn("Spot file {} line {} is not numeric, skipped", spotFile, i + 1);
        continue;
      }
      rows.add(row);
    }
    return rows.toArray(new double[0][]);
  }
}
