package com.flamingo.dozor.service.protocol;

import com.flamingo.dozor.domain.BadRegion;
import com.flamingo.dozor.domain.RunParameters;
import com.flamingo.dozor.exception.ProtocolEncodingException;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the {@code dozor.dat} command file for one batch.
 *
 * <p>The file is a sequence of {@code key value} lines between a {@code !} line and an {@code
 * end} line. Field order and numeric precision must match what the dozor binary expects.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandEncoder {

  static final int PIXEL_MIN = 0;
  static final int PIXEL_MAX = 64000;

  private final DetectorSettingsResolver detectorSettingsResolver;
  private final LibraryResolver libraryResolver;

  /**
   * Encodes the run parameters.
   *
   * @param params parameters of one batch
   * @return the command file contents, newline terminated
   * @throws ProtocolEncodingException if a required parameter is missing
   * @throws com.flamingo.dozor.exception.ConfigurationException if detector, bad region or library
   *     cannot be resolved
   */
  public String encode(RunParameters params) {
    String detectorType = require(params.getDetectorType(), "detectorType");
    DetectorGeometry geometry = detectorSettingsResolver.geometry(detectorType);
    Optional<BadRegion> badRegion =
        detectorSettingsResolver.badRegion(detectorType, params.getBeamline());
    String library = libraryResolver.resolve(detectorType, params.isSubmit());

    double oscillationRange = require(params.getOscillationRange(), "oscillationRange");
    int firstImageNumber = require(params.getFirstImageNumber(), "firstImageNumber");

    StringBuilder command = new StringBuilder();
    line(command, "!");
    line(command, "detector " + detectorType);
    line(command, "library " + library);
    line(command, "nx " + geometry.nx());
    line(command, "ny " + geometry.ny());
    line(command, "pixel " + format("%f", geometry.pixelSize()));
    line(command, "exposure " + format("%.3f", require(params.getExposureTime(), "exposureTime")));
    line(command, "spot_size " + require(params.getSpotSize(), "spotSize"));
    line(command, "spot_level " + require(params.getSpotLevel(), "spotLevel"));
    line(
        command,
        "detector_distance "
            + format("%.3f", require(params.getDetectorDistance(), "detectorDistance")));
    line(
        command,
        "X-ray_wavelength " + format("%.3f", require(params.getWavelength(), "wavelength")));
    line(
        command,
        "fraction_polarization "
            + format(
                "%.3f",
                params.getFractionPolarization() != null
                    ? params.getFractionPolarization()
                    : RunParameters.DEFAULT_FRACTION_POLARIZATION));
    line(command, "pixel_min " + PIXEL_MIN);
    line(command, "pixel_max " + PIXEL_MAX);
    badRegion.ifPresent(
        region -> {
          line(command, "ix_min " + region.ixMin());
          line(command, "ix_max " + region.ixMax());
          line(command, "iy_min " + region.iyMin());
          line(command, "iy_max " + region.iyMax());
        });
    detectorSettingsResolver.badZona().ifPresent(zona -> line(command, "bad_zona " + zona));
    line(command, "orgx " + format("%.1f", require(params.getOrgx(), "orgx")));
    line(command, "orgy " + format("%.1f", require(params.getOrgy(), "orgy")));
    line(command, "oscillation_range " + format("%.3f", oscillationRange));
    line(
        command,
        "image_step "
            + format(
                "%.3f",
                params.getImageStep() != null
                    ? params.getImageStep()
                    : RunParameters.DEFAULT_IMAGE_STEP));
    line(
        command,
        "starting_angle "
            + format(
                "%.3f",
                overallStartingAngle(
                    require(params.getStartingAngle(), "startingAngle"),
                    firstImageNumber,
                    oscillationRange)));
    line(command, "first_image_number " + firstImageNumber);
    line(command, "number_images " + require(params.getNumberImages(), "numberImages"));
    if (params.getWedgeNumber() != null) {
      line(command, "wedge_number " + params.getWedgeNumber());
    }
    line(
        command,
        "name_template_image " + require(params.getNameTemplateImage(), "nameTemplateImage"));
    line(command, "end");

    log.debug(
        "Encoded command file for template {}, first image {}, {} images",
        params.getNameTemplateImage(),
        firstImageNumber,
        params.getNumberImages());
    return command.toString();
  }

  /**
   * Angle image number 1 would have started at, given the starting angle of the batch's first
   * image.
   */
  public static double overallStartingAngle(
      double startingAngle, int firstImageNumber, double oscillationRange) {
    return startingAngle - (firstImageNumber - 1) * oscillationRange;
  }

  private static void line(StringBuilder command, String text) {
    command.append(text).append('\n');
  }

  private static String format(String pattern, double value) {
    return String.format(Locale.ROOT, pattern, value);
  }

  private static <T> T require(T value, String name) {
    if (value == null) {
      throw new ProtocolEncodingException("Missing run parameter: " + name);
    }
    return value;
  }
}
