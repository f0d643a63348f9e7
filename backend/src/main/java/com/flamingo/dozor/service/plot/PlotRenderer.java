package com.flamingo.dozor.service.plot;

import com.flamingo.dozor.domain.plot.PlotBlock;
import com.flamingo.dozor.domain.plot.PlotDocument;
import com.flamingo.dozor.domain.plot.SubPlot;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Stroke;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.springframework.stereotype.Service;

/**
 * Renders each block of a decoded plot file as a line chart PNG.
 *
 * <p>Series carrying a {@code markercolor} attribute are drawn as blue dash-dot lines with square
 * markers, all others as plain red lines. The block's {@code xmin} and {@code ymin} attributes
 * override the lower axis bounds.
 */
@Service
@Slf4j
public class PlotRenderer {

  static final int WIDTH = 480;
  static final int HEIGHT = 360;

  static final Color MARKER_SERIES_COLOR = Color.BLUE;
  static final Color PLAIN_SERIES_COLOR = Color.RED;
  private static final Stroke DASH_DOT =
      new BasicStroke(
          2f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10f, new float[] {8f, 4f, 2f, 4f}, 0f);
  private static final Stroke SOLID = new BasicStroke(2f);

  /**
   * Renders every block of the document.
   *
   * @param document decoded plot file
   * @param outputDirectory directory the PNG files are written to
   * @return written files, in block order
   * @throws IOException if a file cannot be written
   */
  public List<Path> render(PlotDocument document, Path outputDirectory) throws IOException {
    List<Path> files = new ArrayList<>();
    for (PlotBlock block : document.blocks()) {
      if (block.subPlots().stream().allMatch(subPlot -> subPlot.xValues().isEmpty())) {
        log.debug("Plot '{}' has no data, skipped", block.name());
        continue;
      }
      Path file = outputDirectory.resolve(fileName(block.name()));
      ChartUtils.saveChartAsPNG(file.toFile(), createChart(block), WIDTH, HEIGHT);
      files.add(file);
    }
    log.debug("Rendered {} plots to {}", files.size(), outputDirectory);
    return files;
  }

  /** PNG file name of a plot: spaces dropped, dots replaced by underscores. */
  public static String fileName(String plotName) {
    return plotName.replace(" ", "").replace('.', '_') + ".png";
  }

  JFreeChart createChart(PlotBlock block) {
    XYSeriesCollection dataset = new XYSeriesCollection();
    for (SubPlot subPlot : block.subPlots()) {
      // autoSort off keeps file order, duplicates allowed
      XYSeries series = new XYSeries(seriesKey(subPlot, dataset), false, true);
      for (int i = 0; i < subPlot.xValues().size(); i++) {
        series.add(subPlot.xValues().get(i), subPlot.yValues().get(i));
      }
      dataset.addSeries(series);
    }

    JFreeChart chart =
        ChartFactory.createXYLineChart(
            block.name(),
            block.attribute("xlabel"),
            block.attribute("ylabel"),
            dataset,
            PlotOrientation.VERTICAL,
            true,
            false,
            false);
    chart.setBackgroundPaint(Color.WHITE);

    XYPlot plot = chart.getXYPlot();
    plot.setBackgroundPaint(Color.WHITE);
    plot.setRenderer(seriesRenderer(block));

    NumberAxis domainAxis = (NumberAxis) plot.getDomainAxis();
    domainAxis.setAutoRangeIncludesZero(false);
    lowerBound(block.attribute("xmin"), domainAxis);
    NumberAxis rangeAxis = (NumberAxis) plot.getRangeAxis();
    rangeAxis.setAutoRangeIncludesZero(false);
    lowerBound(block.attribute("ymin"), rangeAxis);
    return chart;
  }

  private XYLineAndShapeRenderer seriesRenderer(PlotBlock block) {
    XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
    Rectangle2D square = new Rectangle2D.Double(-3, -3, 6, 6);
    for (int i = 0; i < block.subPlots().size(); i++) {
      boolean marked = block.subPlots().get(i).attribute("markercolor") != null;
      renderer.setSeriesPaint(i, marked ? MARKER_SERIES_COLOR : PLAIN_SERIES_COLOR);
      renderer.setSeriesStroke(i, marked ? DASH_DOT : SOLID);
      renderer.setSeriesShapesVisible(i, marked);
      if (marked) {
        renderer.setSeriesShape(i, square);
      }
    }
    return renderer;
  }

  /** Legend label; series keys must be unique within a dataset. */
  private static String seriesKey(SubPlot subPlot, XYSeriesCollection dataset) {
    String label = subPlot.attribute("linelabel");
    String key = label != null ? label : subPlot.name();
    if (dataset.getSeriesIndex(key) < 0) {
      return key;
    }
    return key + " (" + (dataset.getSeriesCount() + 1) + ")";
  }

  private static void lowerBound(String attribute, NumberAxis axis) {
    if (attribute == null) {
      return;
    }
    try {
      axis.setLowerBound(Double.parseDouble(attribute));
    } catch (NumberFormatException e) {
      log.warn("Ignoring non-numeric axis bound '{}' on {}", attribute, axis.getLabel());
    }
  }
}
