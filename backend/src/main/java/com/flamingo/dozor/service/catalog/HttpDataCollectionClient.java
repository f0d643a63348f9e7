package com.flamingo.dozor.service.catalog;

import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.DataCollection;
import com.flamingo.dozor.exception.ConfigurationException;
import com.flamingo.dozor.exception.ExternalServiceException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** HTTP client for the catalog service ({@code GET /data-collections/{id}}). */
@Component
@Slf4j
public class HttpDataCollectionClient implements DataCollectionCatalog {

  static final String SERVICE_NAME = "catalog";

  private final WebClient webClient;
  private final int readTimeoutMs;

  @Autowired
  public HttpDataCollectionClient(DozorConfig dozorConfig) {
    this(
        WebClient.builder()
            .baseUrl(dozorConfig.getCatalog().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build(),
        dozorConfig.getCatalog().getReadTimeoutMs());
    log.info("Catalog client initialized: baseUrl={}", dozorConfig.getCatalog().getBaseUrl());
  }

  HttpDataCollectionClient(WebClient webClient, int readTimeoutMs) {
    this.webClient = webClient;
    this.readTimeoutMs = readTimeoutMs;
  }

  @Override
  public DataCollection getDataCollection(long dataCollectionId) {
    DataCollection dataCollection;
    try {
      dataCollection =
          webClient
              .get()
              .uri("/data-collections/{id}", dataCollectionId)
              .retrieve()
              .bodyToMono(DataCollection.class)
              .timeout(Duration.ofMillis(readTimeoutMs))
              .block();
    } catch (WebClientResponseException.NotFound e) {
      throw new ConfigurationException("Unknown data collection: " + dataCollectionId, e);
    } catch (RuntimeException e) {
      throw new ExternalServiceException(
          SERVICE_NAME,
          "Catalog request failed for data collection " + dataCollectionId + ": " + e.getMessage(),
          e);
    }
    if (dataCollection == null) {
      throw new ConfigurationException("Unknown data collection: " + dataCollectionId);
    }
    log.debug("Fetched data collection {}", dataCollectionId);
    return dataCollection;
  }
}
