package com.flamingo.dozor.domain.plot;

import java.util.List;

/** A decoded plot description file: one block per plot to render. */
public record PlotDocument(List<PlotBlock> blocks) {

  public PlotDocument {
    blocks = List.copyOf(blocks);
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }
}
