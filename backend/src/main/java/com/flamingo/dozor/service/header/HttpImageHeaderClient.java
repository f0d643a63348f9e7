package com.flamingo.dozor.service.header;

import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.ImageHeader;
import com.flamingo.dozor.exception.ExternalServiceException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the image header service ({@code POST /headers}). */
@Component
@Slf4j
public class HttpImageHeaderClient implements ImageHeaderService {

  static final String SERVICE_NAME = "image header";

  private final WebClient webClient;
  private final int readTimeoutMs;

  @Autowired
  public HttpImageHeaderClient(DozorConfig dozorConfig) {
    this(
        WebClient.builder()
            .baseUrl(dozorConfig.getHeaderService().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build(),
        dozorConfig.getHeaderService().getReadTimeoutMs());
    log.info(
        "Image header client initialized: baseUrl={}",
        dozorConfig.getHeaderService().getBaseUrl());
  }

  HttpImageHeaderClient(WebClient webClient, int readTimeoutMs) {
    this.webClient = webClient;
    this.readTimeoutMs = readTimeoutMs;
  }

  @Override
  public ImageHeader readHeader(String imagePath) {
    log.debug("Reading header of {}", imagePath);
    ImageHeader header;
    try {
      header =
          webClient
              .post()
              .uri("/headers")
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(new HeaderRequest(imagePath))
              .retrieve()
              .bodyToMono(ImageHeader.class)
              .timeout(Duration.ofMillis(readTimeoutMs))
              .block();
    } catch (RuntimeException e) {
      throw new ExternalServiceException(
          SERVICE_NAME, "Header request failed for " + imagePath + ": " + e.getMessage(), e);
    }
    if (header == null) {
      throw new ExternalServiceException(SERVICE_NAME, "Empty header returned for " + imagePath);
    }
    return header;
  }

  record HeaderRequest(String imagePath) {}
}
