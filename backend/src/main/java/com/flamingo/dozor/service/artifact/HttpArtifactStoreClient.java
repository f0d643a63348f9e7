package com.flamingo.dozor.service.artifact;

import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.exception.ExternalServiceException;
import java.nio.file.Path;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the artifact store. Files are sent as one multipart request to {@code POST
 * /data-collections/{id}/quality-indicators}.
 */
@Component
@Slf4j
public class HttpArtifactStoreClient implements ArtifactStore {

  static final String SERVICE_NAME = "artifact store";

  private final WebClient webClient;
  private final int readTimeoutMs;

  @Autowired
  public HttpArtifactStoreClient(DozorConfig dozorConfig) {
    this(
        WebClient.builder().baseUrl(dozorConfig.getArtifactStore().getBaseUrl()).build(),
        dozorConfig.getArtifactStore().getReadTimeoutMs());
    log.info(
        "Artifact store client initialized: baseUrl={}",
        dozorConfig.getArtifactStore().getBaseUrl());
  }

  HttpArtifactStoreClient(WebClient webClient, int readTimeoutMs) {
    this.webClient = webClient;
    this.readTimeoutMs = readTimeoutMs;
  }

  @Override
  public void storeQualityIndicators(long dataCollectionId, Path csvFile, Path plotFile) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part("csv", new FileSystemResource(csvFile));
    if (plotFile != null) {
      body.part("plot", new FileSystemResource(plotFile));
    }
    try {
      webClient
          .post()
          .uri("/data-collections/{id}/quality-indicators", dataCollectionId)
          .contentType(MediaType.MULTIPART_FORM_DATA)
          .body(BodyInserters.fromMultipartData(body.build()))
          .retrieve()
          .toBodilessEntity()
          .timeout(Duration.ofMillis(readTimeoutMs))
          .block();
    } catch (RuntimeException e) {
      throw new ExternalServiceException(
          SERVICE_NAME,
          "Upload failed for data collection " + dataCollectionId + ": " + e.getMessage(),
          e);
    }
    log.debug("Uploaded quality indicators of data collection {}", dataCollectionId);
  }
}
