package com.flamingo.dozor.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.dozor.domain.ImageResultRecord;
import com.flamingo.dozor.domain.RunResult;
import java.nio.file.Path;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a dozor run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunResponse {

  /** COMPLETE, PARTIAL or FAILED. */
  private String status;

  private String detectorType;
  private Double halfDoseTime;
  private int batchCount;
  private int failedBatchCount;
  private List<ImageResultRecord> imageQualityIndicators;
  private List<String> plotFiles;
  private String summaryCsv;
  private String summaryPlot;

  /** Mesh results of all batches, set for mesh runs only. */
  private String dozorAllFile;

  /** Creates a RunResponse from a run result. */
  public static RunResponse fromResult(RunResult result) {
    return RunResponse.builder()
        .status(status(result))
        .detectorType(result.detectorType())
        .halfDoseTime(result.halfDoseTime())
        .batchCount(result.batchCount())
        .failedBatchCount(result.failedBatchCount())
        .imageQualityIndicators(result.records())
        .plotFiles(result.plotFiles().stream().map(Path::toString).toList())
        .summaryCsv(result.summaryCsv() != null ? result.summaryCsv().toString() : null)
        .summaryPlot(result.summaryPlot() != null ? result.summaryPlot().toString() : null)
        .dozorAllFile(result.meshFile() != null ? result.meshFile().toString() : null)
        .build();
  }

  private static String status(RunResult result) {
    if (result.isComplete()) {
      return "COMPLETE";
    }
    return result.isPartial() ? "PARTIAL" : "FAILED";
  }
}
