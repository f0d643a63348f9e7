package com.flamingo.dozor.service.protocol;

/**
 * Pixel layout of a detector.
 *
 * @param nx number of pixels along x
 * @param ny number of pixels along y
 * @param pixelSize pixel size in mm
 */
public record DetectorGeometry(int nx, int ny, double pixelSize) {}
