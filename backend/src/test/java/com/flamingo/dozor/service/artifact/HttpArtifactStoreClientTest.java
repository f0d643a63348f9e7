package com.flamingo.dozor.service.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.dozor.exception.ExternalServiceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("HttpArtifactStoreClient Tests")
class HttpArtifactStoreClientTest {

  @TempDir Path dir;

  private static HttpArtifactStoreClient client(
      HttpStatus status, AtomicReference<ClientRequest> captured) {
    WebClient webClient =
        WebClient.builder()
            .baseUrl("http://store.test")
            .exchangeFunction(
                request -> {
                  captured.set(request);
                  return Mono.just(ClientResponse.create(status).build());
                })
            .build();
    return new HttpArtifactStoreClient(webClient, 1000);
  }

  @Test
  @DisplayName("Should post the files to the data collection")
  void shouldUploadFiles() throws IOException {
    Path csv = Files.writeString(dir.resolve("dozor_42.csv"), "csv");
    AtomicReference<ClientRequest> captured = new AtomicReference<>();

    client(HttpStatus.CREATED, captured).storeQualityIndicators(42L, csv, null);

    assertThat(captured.get().url().toString())
        .isEqualTo("http://store.test/data-collections/42/quality-indicators");
    assertThat(captured.get().headers().getContentType().toString())
        .startsWith("multipart/form-data");
  }

  @Test
  @DisplayName("Should wrap a rejected upload as an external service failure")
  void shouldWrapFailure() throws IOException {
    Path csv = Files.writeString(dir.resolve("dozor_42.csv"), "csv");

    assertThatThrownBy(
            () ->
                client(HttpStatus.SERVICE_UNAVAILABLE, new AtomicReference<>())
                    .storeQualityIndicators(42L, csv, null))
        .isInstanceOf(ExternalServiceException.class);
  }
}
