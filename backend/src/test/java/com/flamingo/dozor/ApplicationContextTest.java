package com.flamingo.dozor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.flamingo.dozor.exception.ExternalServiceException;
import com.flamingo.dozor.service.artifact.ArtifactStore;
import com.flamingo.dozor.service.artifact.QualityIndicatorUploader;
import com.flamingo.dozor.service.catalog.DataCollectionCatalog;
import com.flamingo.dozor.service.header.ImageHeaderService;
import com.flamingo.dozor.service.orchestration.BatchOrchestrator;
import com.flamingo.dozor.service.orchestration.DozorRunService;
import com.flamingo.dozor.service.protocol.CommandEncoder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the application context loads. The HTTP services are mocked so the test runs without
 * the header service, catalog or artifact store.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private ImageHeaderService imageHeaderService;
  @MockitoBean private DataCollectionCatalog dataCollectionCatalog;
  @MockitoBean private ArtifactStore artifactStore;

  @Autowired private ApplicationContext applicationContext;
  @Autowired private QualityIndicatorUploader qualityIndicatorUploader;
  @Autowired private MeterRegistry meterRegistry;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DozorRunService.class)).isNotNull();
    assertThat(applicationContext.getBean(BatchOrchestrator.class)).isNotNull();
    assertThat(applicationContext.getBean(CommandEncoder.class)).isNotNull();
    assertThat(applicationContext.getBean("subWedgeExecutor")).isNotNull();
  }

  @Test
  @DisplayName("Upload should be retried and then dropped when the store stays down")
  void uploadShouldRetryThenFallBack() {
    doThrow(new ExternalServiceException("artifact store", "unavailable"))
        .when(artifactStore)
        .storeQualityIndicators(anyLong(), any(), any());

    boolean uploaded =
        qualityIndicatorUploader.upload(42L, Path.of("/run/dozor_42.csv"), null);

    assertThat(uploaded).isFalse();
    verify(artifactStore, times(3)).storeQualityIndicators(anyLong(), any(), any());
  }

  @Test
  @DisplayName("Timed services should record their duration")
  void timedServicesShouldRecordDuration() {
    qualityIndicatorUploader.upload(7L, Path.of("/run/dozor_7.csv"), null);

    Timer timer = meterRegistry.find("dozor.upload").timer();
    assertThat(timer).isNotNull();
    assertThat(timer.count()).isPositive();
  }
}
