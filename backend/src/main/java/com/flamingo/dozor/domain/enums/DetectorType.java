package com.flamingo.dozor.domain.enums;

import com.flamingo.dozor.domain.BadRegion;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Detectors known to the encoder, with their pixel dimensions, pixel size (mm) and, for some, a
 * default bad region that dozor should ignore.
 */
public enum DetectorType {
  PILATUS_2M("pilatus2m", 1475, 1679, 0.172, new BadRegion(1, 776, 826, 894)),
  PILATUS3_2M("pilatus3_2m", 1475, 1679, 0.172, null),
  PILATUS_6M("pilatus6m", 2463, 2527, 0.172, new BadRegion(1, 1230, 1228, 1298)),
  EIGER_4M("eiger4m", 2070, 2167, 0.075, new BadRegion(1, 1120, 1025, 1140)),
  EIGER_9M("eiger9m", 3110, 3269, 0.075, null),
  EIGER_16M("eiger16m", 4150, 4371, 0.075, null),
  EIGER2_16M("eiger2_16m", 4148, 4362, 0.075, null);

  private final String id;
  private final int nx;
  private final int ny;
  private final double pixelSize;
  private final BadRegion defaultBadRegion;

  DetectorType(String id, int nx, int ny, double pixelSize, BadRegion defaultBadRegion) {
    this.id = id;
    this.nx = nx;
    this.ny = ny;
    this.pixelSize = pixelSize;
    this.defaultBadRegion = defaultBadRegion;
  }

  public String getId() {
    return id;
  }

  public int getNx() {
    return nx;
  }

  public int getNy() {
    return ny;
  }

  public double getPixelSize() {
    return pixelSize;
  }

  public Optional<BadRegion> getDefaultBadRegion() {
    return Optional.ofNullable(defaultBadRegion);
  }

  /** Looks up a detector by the identifier used in image headers and in the command file. */
  public static Optional<DetectorType> fromId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(d -> d.id.equalsIgnoreCase(id)).findFirst();
  }

  /** Eiger detectors write HDF5 containers; everything else writes CBF files. */
  public static boolean isContainerFormat(String detectorId) {
    return detectorId != null && detectorId.toLowerCase(Locale.ROOT).startsWith("eiger");
  }
}
