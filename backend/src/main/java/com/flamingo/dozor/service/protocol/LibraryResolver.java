package com.flamingo.dozor.service.protocol;

import com.flamingo.dozor.config.DozorConfig;
import com.flamingo.dozor.domain.enums.DetectorType;
import com.flamingo.dozor.exception.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the image-format library dozor loads: {@code hdf5} for container detectors, {@code cbf}
 * otherwise, built for the OS dozor runs on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LibraryResolver {

  static final Path OS_RELEASE = Path.of("/etc/os-release");

  private final DozorConfig dozorConfig;

  /**
   * Returns the configured library path for the detector's image format.
   *
   * @param detectorType detector identifier
   * @param submit whether dozor runs on the cluster, whose OS is fixed by configuration
   * @throws ConfigurationException if the OS is unsupported or no library is configured
   */
  public String resolve(String detectorType, boolean submit) {
    String libraryType = DetectorType.isContainerFormat(detectorType) ? "hdf5" : "cbf";
    DozorConfig.Library library = dozorConfig.getLibrary();

    String key = libraryType + "_" + (submit ? library.getSubmitOsVersion() : localOsVersion());
    String path = library.getPaths().get(key);
    if (path == null) {
      throw new ConfigurationException("Library configuration " + key + " not found");
    }
    log.debug("Resolved {} library for {}: {}", libraryType, detectorType, path);
    return path;
  }

  private String localOsVersion() {
    DozorConfig.Library library = dozorConfig.getLibrary();
    String osId = library.getOsId();
    String version = library.getOsVersion();
    if (osId == null || version == null) {
      Map<String, String> release = readOsRelease();
      osId = osId != null ? osId : release.getOrDefault("ID", "");
      version = version != null ? version : release.getOrDefault("VERSION_ID", "");
    }
    String normalized = osId.toLowerCase(Locale.ROOT);
    if (normalized.contains("debian")) {
      return "debian_" + version;
    }
    if (normalized.equals("ubuntu")) {
      return "ubuntu_" + version;
    }
    throw new ConfigurationException("Unknown OS name: " + osId);
  }

  Map<String, String> readOsRelease() {
    Map<String, String> values = new HashMap<>();
    try {
      List<String> lines = Files.readAllLines(OS_RELEASE);
      for (String line : lines) {
        int eq = line.indexOf('=');
        if (eq > 0) {
          values.put(line.substring(0, eq).trim(), line.substring(eq + 1).trim().replace("\"", ""));
        }
      }
    } catch (IOException e) {
      throw new ConfigurationException("Cannot determine OS version from " + OS_RELEASE, e);
    }
    return values;
  }
}
