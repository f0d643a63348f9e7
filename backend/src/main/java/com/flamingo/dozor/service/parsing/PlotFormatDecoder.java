package com.flamingo.dozor.service.parsing;

import com.flamingo.dozor.domain.plot.PlotBlock;
import com.flamingo.dozor.domain.plot.PlotDocument;
import com.flamingo.dozor.domain.plot.SubPlot;
import com.flamingo.dozor.exception.PlotFormatException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes plotmtv-style plot description files such as {@code dozor_rd.mtv}.
 *
 * <pre>
 * $ DATA=CURVE2D
 * % toplabel = 'Plot1'
 * % xlabel = 'dose'
 * # Series A
 * % linelabel = 'A'
 * 1.0 2.0
 * 2.0 3.0
 * </pre>
 *
 * A {@code $} line opens a block whose name is quoted on the following line. {@code %} lines
 * assign attributes to the block or subplot opened last. A {@code #} line opens a subplot named by
 * the rest of the line. Any other non-blank line is an x/y data row of the open subplot.
 */
@Slf4j
@Component
public class PlotFormatDecoder {

  private enum State {
    AWAITING_BLOCK,
    IN_BLOCK_ATTRIBUTES,
    AWAITING_SUBPLOT_OR_DATA,
    IN_SUBPLOT_ATTRIBUTES,
    IN_SUBPLOT_DATA
  }

  /**
   * Decodes a plot description file.
   *
   * @param text file contents
   * @return the decoded blocks in file order; empty for empty input
   * @throws PlotFormatException on the first malformed line
   */
  public PlotDocument decode(String text) {
    List<PlotBlock> blocks = new ArrayList<>();
    BlockBuilder block = null;
    SubPlotBuilder subPlot = null;
    State state = State.AWAITING_BLOCK;

    String[] lines = text.split("\\r?\n", -1);
    for (int index = 0; index < lines.length; index++) {
      String line = lines[index];
      int lineNumber = index + 1;
      if (line.isBlank()) {
        continue;
      }
      if (!line.startsWith("%")) {
        if (state == State.IN_BLOCK_ATTRIBUTES) {
          state = State.AWAITING_SUBPLOT_OR_DATA;
        } else if (state == State.IN_SUBPLOT_ATTRIBUTES) {
          state = State.IN_SUBPLOT_DATA;
        }
      }

      if (line.startsWith("$")) {
        if (block != null) {
          blocks.add(block.build(subPlot));
        }
        subPlot = null;
        index = nextNonBlank(lines, index + 1);
        if (index >= lines.length) {
          throw new PlotFormatException(lineNumber, "Plot block without a name line");
        }
        block = new BlockBuilder(quotedOrTrimmed(lines[index]));
        state = State.IN_BLOCK_ATTRIBUTES;
      } else if (line.startsWith("%")) {
        switch (state) {
          case IN_BLOCK_ATTRIBUTES -> putAttribute(block.attributes, line, lineNumber);
          case IN_SUBPLOT_ATTRIBUTES -> putAttribute(subPlot.attributes, line, lineNumber);
          default -> throw new PlotFormatException(
              lineNumber, "Attribute outside a block or subplot header");
        }
      } else if (line.startsWith("#")) {
        if (block == null) {
          throw new PlotFormatException(lineNumber, "Subplot outside a plot block");
        }
        if (subPlot != null) {
          block.subPlots.add(subPlot.build());
        }
        subPlot = new SubPlotBuilder(line.substring(1).trim());
        state = State.IN_SUBPLOT_ATTRIBUTES;
      } else {
        if (state != State.IN_SUBPLOT_DATA) {
          throw new PlotFormatException(lineNumber, "Data row outside a subplot");
        }
        addDataRow(subPlot, line, lineNumber);
      }
    }
    if (block != null) {
      blocks.add(block.build(subPlot));
    }

    log.debug("Decoded plot file with {} blocks", blocks.size());
    return new PlotDocument(blocks);
  }

  private static int nextNonBlank(String[] lines, int from) {
    int index = from;
    while (index < lines.length && lines[index].isBlank()) {
      index++;
    }
    return index;
  }

  private static void putAttribute(Map<String, String> attributes, String line, int lineNumber) {
    int equals = line.indexOf('=');
    if (equals < 0) {
      throw new PlotFormatException(lineNumber, "Attribute line without '=': " + line.trim());
    }
    String label = line.substring(1, equals).trim();
    String value = line.substring(equals + 1);
    attributes.put(label, quotedOrTrimmed(value));
  }

  /** Text between the first pair of single quotes, or the trimmed text when it is not quoted. */
  private static String quotedOrTrimmed(String text) {
    int open = text.indexOf('\'');
    if (open >= 0) {
      int close = text.indexOf('\'', open + 1);
      return close >= 0 ? text.substring(open + 1, close).trim() : text.substring(open + 1).trim();
    }
    return text.trim();
  }

  private static void addDataRow(SubPlotBuilder subPlot, String line, int lineNumber) {
    String[] tokens = line.trim().split("\\s+");
    if (tokens.length < 2) {
      throw new PlotFormatException(lineNumber, "Data row needs x and y values: " + line.trim());
    }
    try {
      subPlot.xValues.add(Double.parseDouble(tokens[0]));
      subPlot.yValues.add(Double.parseDouble(tokens[1]));
    } catch (NumberFormatException e) {
      throw new PlotFormatException(lineNumber, "Data row is not numeric: " + line.trim(), e);
    }
  }

  private static final class BlockBuilder {
    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<SubPlot> subPlots = new ArrayList<>();

    private BlockBuilder(String name) {
      this.name = name;
    }

    private PlotBlock build(SubPlotBuilder openSubPlot) {
      if (openSubPlot != null) {
        subPlots.add(openSubPlot.build());
      }
      return new PlotBlock(name, attributes, subPlots);
    }
  }

  private static final class SubPlotBuilder {
    private final String name;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<Double> xValues = new ArrayList<>();
    private final List<Double> yValues = new ArrayList<>();

    private SubPlotBuilder(String name) {
      this.name = name;
    }

    private SubPlot build() {
      return new SubPlot(name, attributes, xValues, yValues);
    }
  }
}
