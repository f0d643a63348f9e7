package com.flamingo.dozor.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Dozor's result for one image. Every measured value may be null when its column could not be
 * parsed; the powder Wilson statistics are only present in the extended column layout.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImageResultRecord {

  public static final double DEFAULT_VISIBLE_RESOLUTION = 40.0;

  int number;
  String image;
  double angle;
  Integer spotsNumOf;
  Double spotsIntAver;
  Double spotsRFactor;
  Double spotsResolution;
  Double powderWilsonScale;
  Double powderWilsonBfactor;
  Double powderWilsonResolution;
  Double powderWilsonCorrelation;
  Double powderWilsonRfactor;
  Double mainScore;
  Double spotScore;
  @Builder.Default Double visibleResolution = DEFAULT_VISIBLE_RESOLUTION;
  String spotFile;
  double[][] spotList;
}
