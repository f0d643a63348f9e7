package com.flamingo.dozor.service.artifact;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Uploads the quality indicators of a data collection to the artifact store. Failed uploads are
 * retried; when the store stays unavailable the upload is dropped with a warning and the run
 * result is unaffected.
 *
 * <p>Retry wraps the circuit breaker, so the fallback sits on the retry and sees the final
 * failure, including calls rejected by an open circuit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityIndicatorUploader {

  private final ArtifactStore artifactStore;
  private final MeterRegistry meterRegistry;

  /**
   * Uploads the CSV and plot.
   *
   * @return true if the store accepted the files
   */
  @Timed(value = "dozor.upload", description = "Time to upload quality indicators")
  @CircuitBreaker(name = "artifactStore")
  @Retry(name = "artifactStore", fallbackMethod = "uploadFallback")
  public boolean upload(long dataCollectionId, Path csvFile, Path plotFile) {
    log.info("Uploading quality indicators of data collection {}", dataCollectionId);
    artifactStore.storeQualityIndicators(dataCollectionId, csvFile, plotFile);
    meterRegistry.counter("dozor.upload.success").increment();
    return true;
  }

  @SuppressWarnings("unused")
  boolean uploadFallback(long dataCollectionId, Path csvFile, Path plotFile, Throwable t) {
    log.warn(
        "Artifact store unavailable, quality indicators of data collection {} not uploaded: {}",
        dataCollectionId,
        t.getMessage());
    meterRegistry.counter("dozor.upload.fallback").increment();
    return false;
  }
}
