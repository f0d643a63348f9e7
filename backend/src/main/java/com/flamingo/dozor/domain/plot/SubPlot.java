package com.flamingo.dozor.domain.plot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One series of a plot.
 *
 * @param name series name
 * @param attributes series attributes, e.g. {@code linelabel}, {@code markercolor}
 * @param xValues x coordinates
 * @param yValues y coordinates, same length as {@code xValues}
 */
public record SubPlot(
    String name, Map<String, String> attributes, List<Double> xValues, List<Double> yValues) {

  public SubPlot {
    if (xValues.size() != yValues.size()) {
      throw new IllegalArgumentException(
          "Series " + name + " has " + xValues.size() + " x and " + yValues.size() + " y values");
    }
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    xValues = List.copyOf(xValues);
    yValues = List.copyOf(yValues);
  }

  public String attribute(String label) {
    return attributes.get(label);
  }
}
