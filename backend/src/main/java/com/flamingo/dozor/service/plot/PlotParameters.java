package com.flamingo.dozor.service.plot;

/**
 * Axis settings of the quality indicator plot.
 *
 * @param xtics gnuplot xtics increment, empty for automatic
 * @param yscale gnuplot command(s) setting the y axis range
 * @param minImageNumber lower bound of the image number axis
 * @param maxImageNumber upper bound of the image number axis
 * @param minAngle lower bound of the angle axis
 * @param maxAngle upper bound of the angle axis
 * @param minScore lowest main score
 * @param maxScore highest main score
 * @param minResolution lower end of the resolution axis (largest d-spacing shown)
 * @param maxResolution upper end of the resolution axis (smallest d-spacing shown)
 */
public record PlotParameters(
    String xtics,
    String yscale,
    double minImageNumber,
    double maxImageNumber,
    double minAngle,
    double maxAngle,
    double minScore,
    double maxScore,
    double minResolution,
    double maxResolution) {}
