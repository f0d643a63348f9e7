package com.flamingo.dozor.domain.plot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One plot: a name, block attributes (axis labels, axis range overrides) and its series.
 *
 * @param name plot title
 * @param attributes attributes in file order
 * @param subPlots series in file order
 */
public record PlotBlock(String name, Map<String, String> attributes, List<SubPlot> subPlots) {

  public PlotBlock {
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    subPlots = List.copyOf(subPlots);
  }

  public String attribute(String label) {
    return attributes.get(label);
  }
}
