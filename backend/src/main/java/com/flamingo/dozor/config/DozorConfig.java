package com.flamingo.dozor.config;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for dozor batch runs. */
@Configuration
@ConfigurationProperties(prefix = "dozor")
@Getter
@Setter
public class DozorConfig {

  /** Root directory under which every run and batch gets its own working directory. */
  private String workingDirectory = "data/dozor";

  private Batch batch = new Batch();
  private Executor executor = new Executor();
  private Library library = new Library();
  private Site site = new Site();
  private Map<String, DetectorOverride> detectors = new LinkedHashMap<>();
  private Plot plot = new Plot();
  private Client headerService = new Client();
  private Client catalog = new Client();
  private Client artifactStore = new Client();

  @Getter
  @Setter
  public static class Batch {
    /** Batch size used when the request does not carry one; null means max-size. */
    private Integer defaultSize;

    private int maxSize = 5000;
  }

  @Getter
  @Setter
  public static class Executor {
    private String executable = "dozor";

    /** Submit to the cluster scheduler instead of running locally. */
    private boolean submit = false;

    private String schedulerCommand = "srun";
    private String slurmPath = "/opt/dozor/bin";
    private String slurmExecutable = "dozor";
    private String slurmPartition;
  }

  /**
   * Paths of the image-format libraries handed to dozor, keyed by {@code
   * <format>_<os>_<version>}, e.g. {@code cbf_ubuntu_20.04}.
   */
  @Getter
  @Setter
  public static class Library {
    private Map<String, String> paths = new LinkedHashMap<>();

    /** Overrides the OS id read from /etc/os-release ("ubuntu" or "debian"). */
    private String osId;

    /** Overrides the OS version read from /etc/os-release. */
    private String osVersion;

    /** OS version of the cluster nodes, used when submitting. */
    private String submitOsVersion = "ubuntu_20.04";
  }

  @Getter
  @Setter
  public static class Site {
    /** Prefix combined with the beamline name to look up a site entry, e.g. "esrf_". */
    private String prefix;

    /** Optional masked-region identifier passed as {@code bad_zona}. */
    private String badZona;

    /** Bad region rectangles keyed by site name (prefix + beamline). */
    private Map<String, BadRegionOverride> badRegions = new LinkedHashMap<>();
  }

  @Getter
  @Setter
  public static class BadRegionOverride {
    private int ixMin;
    private int ixMax;
    private int iyMin;
    private int iyMax;
  }

  @Getter
  @Setter
  public static class DetectorOverride {
    private Integer nx;
    private Integer ny;
    private Double pixelSize;
  }

  @Getter
  @Setter
  public static class Plot {
    private boolean enabled = true;
    private String gnuplot = "gnuplot";
  }

  @Getter
  @Setter
  public static class Client {
    private String baseUrl = "http://localhost:8081";
    private int readTimeoutMs = 30000;
  }
}
