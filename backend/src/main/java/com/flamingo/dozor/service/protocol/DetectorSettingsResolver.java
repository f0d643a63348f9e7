package com.flamingo.dozor.service.protocol;

import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.BadRegion;
import com.flamingo.dozor.domain.enums.DetectorType;
import com.flamingo.dozor.exception.ConfigurationException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves detector geometry and the bad region to exclude, from site configuration first and
 * the built-in detector table second.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectorSettingsResolver {

  private final DozorConfig dozorConfig;

  /**
   * Returns the geometry of a detector. Configured values override the built-in table field by
   * field.
   *
   * @throws ConfigurationException if the detector is neither configured nor built in
   */
  public DetectorGeometry geometry(String detectorType) {
    Optional<DetectorType> builtIn = DetectorType.fromId(detectorType);
    DozorConfig.DetectorOverride override =
        detectorType == null ? null : dozorConfig.getDetectors().get(detectorType);

    Integer nx = builtIn.map(DetectorType::getNx).orElse(null);
    Integer ny = builtIn.map(DetectorType::getNy).orElse(null);
    Double pixelSize = builtIn.map(DetectorType::getPixelSize).orElse(null);
    if (override != null) {
      nx = override.getNx() != null ? override.getNx() : nx;
      ny = override.getNy() != null ? override.getNy() : ny;
      pixelSize = override.getPixelSize() != null ? override.getPixelSize() : pixelSize;
    }
    if (nx == null || ny == null || pixelSize == null) {
      throw new ConfigurationException("Unknown detector type: " + detectorType);
    }
    return new DetectorGeometry(nx, ny, pixelSize);
  }

  /**
   * Returns the bad region for a run: the site entry for {@code prefix + beamline} when a site
   * prefix and a beamline are both known, otherwise the detector's default, if any.
   *
   * @throws ConfigurationException if a site prefix and beamline are given but no site entry
   *     exists for them
   */
  public Optional<BadRegion> badRegion(String detectorType, String beamline) {
    String sitePrefix = dozorConfig.getSite().getPrefix();
    if (sitePrefix != null && beamline != null) {
      String site = sitePrefix + beamline;
      DozorConfig.BadRegionOverride entry = dozorConfig.getSite().getBadRegions().get(site);
      if (entry == null) {
        throw new ConfigurationException("No bad region configured for site " + site);
      }
      log.debug("Using bad region of site {}", site);
      return Optional.of(
          new BadRegion(entry.getIxMin(), entry.getIxMax(), entry.getIyMin(), entry.getIyMax()));
    }
    return DetectorType.fromId(detectorType).flatMap(DetectorType::getDefaultBadRegion);
  }

  /** Masked-region identifier passed as {@code bad_zona}, if configured. */
  public Optional<String> badZona() {
    return Optional.ofNullable(dozorConfig.getSite().getBadZona());
  }
}
