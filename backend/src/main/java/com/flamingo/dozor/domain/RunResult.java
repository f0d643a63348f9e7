package com.flamingo.dozor.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Aggregated result of all batches of one run.
 *
 * @param records records of every successful batch, in batch submission order
 * @param detectorType detector of the last batch whose header was read, or null
 * @param halfDoseTime half-dose time of the last batch reporting one, or null
 * @param batchCount number of batches submitted
 * @param failedBatchCount number of batches that contributed no records
 * @param plotFiles PNG plots rendered from plot description files
 * @param summaryCsv quality indicator CSV, or null when no summary was written
 * @param summaryPlot quality indicator plot, or null when no summary was written
 * @param meshFile concatenated {@code *.all} mesh results of all batches, or null outside mesh
 *     runs
 */
public record RunResult(
    List<ImageResultRecord> records,
    String detectorType,
    Double halfDoseTime,
    int batchCount,
    int failedBatchCount,
    List<Path> plotFiles,
    Path summaryCsv,
    Path summaryPlot,
    Path meshFile) {

  public RunResult {
    records = List.copyOf(records);
    plotFiles = List.copyOf(plotFiles);
  }

  public boolean isComplete() {
    return failedBatchCount == 0;
  }

  public boolean isPartial() {
    return failedBatchCount > 0 && failedBatchCount < batchCount;
  }

  public RunResult withSummary(Path csv, Path plot) {
    return new RunResult(
        records,
        detectorType,
        halfDoseTime,
        batchCount,
        failedBatchCount,
        plotFiles,
        csv,
        plot,
        meshFile);
  }

  public RunResult withRecords(List<ImageResultRecord> newRecords) {
    return new RunResult(
        newRecords,
        detectorType,
        halfDoseTime,
        batchCount,
        failedBatchCount,
        plotFiles,
        summaryCsv,
        summaryPlot,
        meshFile);
  }
}
