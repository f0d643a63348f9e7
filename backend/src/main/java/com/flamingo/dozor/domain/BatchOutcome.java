package com.flamingo.dozor.domain;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of running one batch.
 *
 * @param batch the batch that was run
 * @param success false when the batch contributed no records
 * @param detectorType detector read from the batch's first image header, or null
 * @param decodedLog decoded dozor output, or null on failure
 * @param workingDirectory directory dozor ran in
 * @param plotFiles PNG files rendered from the batch's plot description file
 * @param meshFile the batch's {@code *.all} mesh results joined into one file, or null
 */
public record BatchOutcome(
    Batch batch,
    boolean success,
    String detectorType,
    DecodedLog decodedLog,
    Path workingDirectory,
    List<Path> plotFiles,
    Path meshFile) {

  public static BatchOutcome failed(Batch batch, String detectorType, Path workingDirectory) {
    return new BatchOutcome(batch, false, detectorType, null, workingDirectory, List.of(), null);
  }

  public List<ImageResultRecord> records() {
    return decodedLog == null ? List.of() : decodedLog.records();
  }
}
