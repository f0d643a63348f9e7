package com.flamingo.dozor.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one dozor invocation. Built per batch from the image header of the batch's first
 * image and the shared run options.
 */
@Value
@Builder(toBuilder = true)
public class RunParameters {

  public static final int DEFAULT_SPOT_SIZE = 3;
  public static final int DEFAULT_SPOT_LEVEL = 6;
  public static final double DEFAULT_FRACTION_POLARIZATION = 0.99;
  public static final double DEFAULT_IMAGE_STEP = 1.0;

  String detectorType;
  String beamline;
  Double exposureTime;
  @Builder.Default Integer spotSize = DEFAULT_SPOT_SIZE;
  @Builder.Default Integer spotLevel = DEFAULT_SPOT_LEVEL;
  Double detectorDistance;
  Double wavelength;
  @Builder.Default Double fractionPolarization = DEFAULT_FRACTION_POLARIZATION;

  /** Beam centre in pixels. */
  Double orgx;

  Double orgy;
  Double oscillationRange;
  @Builder.Default Double imageStep = DEFAULT_IMAGE_STEP;

  /** Rotation angle at the start of the batch's first image. */
  Double startingAngle;

  Integer firstImageNumber;
  Integer numberImages;

  /** Image path with the image number replaced by a run of '?' characters. */
  String nameTemplateImage;

  Integer wedgeNumber;
  @Builder.Default double overlap = 0.0;
  boolean radiationDamage;
  boolean submit;
  boolean mesh;
}
