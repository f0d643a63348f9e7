package com.flamingo.dozor.service.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.BadRegion;
import com.flamingo.dozor.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DetectorSettingsResolver Tests")
class DetectorSettingsResolverTest {

  private DozorConfig config;
  private DetectorSettingsResolver resolver;

  @BeforeEach
  void setUp() {
    config = new DozorConfig();
    resolver = new DetectorSettingsResolver(config);
  }

  @Test
  @DisplayName("Should use the built-in geometry of known detectors")
  void shouldUseBuiltInGeometry() {
    assertThat(resolver.geometry("eiger4m")).isEqualTo(new DetectorGeometry(2070, 2167, 0.075));
  }

  @Test
  @DisplayName("Should let configured values override the built-in table")
  void shouldApplyOverride() {
    DozorConfig.DetectorOverride override = new DozorConfig.DetectorOverride();
    override.setNx(1000);
    config.getDetectors().put("eiger4m", override);

    assertThat(resolver.geometry("eiger4m")).isEqualTo(new DetectorGeometry(1000, 2167, 0.075));
  }

  @Test
  @DisplayName("Should accept a fully configured detector unknown to the table")
  void shouldAcceptConfiguredDetector() {
    DozorConfig.DetectorOverride override = new DozorConfig.DetectorOverride();
    override.setNx(3072);
    override.setNy(3072);
    override.setPixelSize(0.1);
    config.getDetectors().put("custom3k", override);

    assertThat(resolver.geometry("custom3k")).isEqualTo(new DetectorGeometry(3072, 3072, 0.1));
  }

  @Test
  @DisplayName("Should fail for detectors neither configured nor built in")
  void shouldFailForUnknownDetector() {
    assertThatThrownBy(() -> resolver.geometry("mar225"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("mar225");
  }

  @Test
  @DisplayName("Should fall back to the detector default bad region without a site")
  void shouldUseDetectorDefaultBadRegion() {
    assertThat(resolver.badRegion("pilatus2m", "id23eh2"))
        .contains(new BadRegion(1, 776, 826, 894));
    assertThat(resolver.badRegion("eiger9m", null)).isEmpty();
  }

  @Test
  @DisplayName("Should fail when a site has no bad region entry")
  void shouldFailForMissingSiteEntry() {
    config.getSite().setPrefix("esrf_");

    assertThatThrownBy(() -> resolver.badRegion("pilatus2m", "id30a1"))
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("esrf_id30a1");
  }
}
