package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Graphs of one extraction pass together with the counters of that pass.
 */
public final class ExtractionReport {
  private final List<FsmGraph> graphs;
  private final ExtractionStatistics statistics;

  ExtractionReport(final List<FsmGraph> graphs, final ExtractionStatistics statistics) {
    this.graphs = Collections.unmodifiableList(new ArrayList<>(graphs));
    this.statistics = statistics;
  }

  public List<FsmGraph> getGraphs() {
    return graphs;
  }

  public ExtractionStatistics getStatistics() {
    return statistics;
  }

  @Override
  public String toString() {
    return "ExtractionReport [graphs=" + graphs.size() + ", statistics=" + statistics + "]";
  }
}
