package com.flamingo.dozor.service.plot;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Files written for the quality indicators of one data collection.
 *
 * @param csvFile per-image indicator table
 * @param gnuplotScript script rendering {@code plotFile}, or null when no row had all indicators
 * @param plotFile PNG the script renders to, or null like {@code gnuplotScript}
 */
public record QualitySummary(Path csvFile, Path gnuplotScript, Path plotFile) {

  public Optional<Path> script() {
    return Optional.ofNullable(gnuplotScript);
  }
}
