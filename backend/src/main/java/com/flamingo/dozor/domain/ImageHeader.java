package com.flamingo.dozor.domain;

/**
 * Header metadata of one detector image as returned by the header service.
 *
 * @param imagePath path of the image the header was read from
 * @param detectorType detector identifier, e.g. {@code pilatus6m}
 * @param pixelSizeX pixel size along x in mm
 * @param pixelSizeY pixel size along y in mm
 * @param beamPositionX beam position along x in mm
 * @param beamPositionY beam position along y in mm
 * @param distance sample-detector distance in mm
 * @param wavelength X-ray wavelength in Angstrom
 * @param exposureTime exposure time in seconds
 * @param oscillationWidth rotation per image in degrees
 * @param rotationAxisStart rotation angle at the start of the image in degrees
 */
public record ImageHeader(
    String imagePath,
    String detectorType,
    double pixelSizeX,
    double pixelSizeY,
    double beamPositionX,
    double beamPositionY,
    double distance,
    double wavelength,
    double exposureTime,
    double oscillationWidth,
    double rotationAxisStart) {}
