package com.flamingo.dozor.service.artifact;

import java.nio.file.Path;

/** Accepts the quality-indicator CSV and plot of a data collection. */
public interface ArtifactStore {

  /**
   * Stores the files under the data collection.
   *
   * @throws com.flamingo.dozor.exception.ExternalServiceException if the store rejects the upload
   */
  void storeQualityIndicators(long dataCollectionId, Path csvFile, Path plotFile);
}
