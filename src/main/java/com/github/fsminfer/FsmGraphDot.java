package com.github.fsminfer;

import java.util.List;

/**
 * Graphviz rendering of FSM graphs. The reset state is drawn as a double circle and guarded edges
 * carry their guard as label.
 */
public final class FsmGraphDot {

  private FsmGraphDot() {}

  public static String toDot(final FsmGraph graph) {
    final StringBuilder dot = new StringBuilder();
    dot.append("digraph ").append(quote(graphName(graph))).append(" {\n");
    dot.append("  rankdir=LR;\n");
    dot.append("  node [shape=circle];\n");
    body(dot, graph, "", "  ");
    dot.append("}\n");
    return dot.toString();
  }

  /**
   * All graphs in one digraph, one cluster each. Node ids carry the cluster index so equally named
   * states of different machines stay apart.
   */
  public static String toDot(final List<FsmGraph> graphs) {
    final StringBuilder dot = new StringBuilder();
    dot.append("digraph \"fsms\" {\n");
    dot.append("  rankdir=LR;\n");
    dot.append("  node [shape=circle];\n");
    for (int iter = 0; iter < graphs.size(); iter++) {
      final FsmGraph graph = graphs.get(iter);
      dot.append("  subgraph cluster_").append(iter).append(" {\n");
      dot.append("    label=").append(quote(graphName(graph))).append(";\n");
      body(dot, graph, iter + "_", "    ");
      dot.append("  }\n");
    }
    dot.append("}\n");
    return dot.toString();
  }

  private static void body(final StringBuilder dot, final FsmGraph graph, final String idPrefix,
      final String pad) {
    final String reset = graph.getResetState().orElse(null);
    for (final String state : graph.getStates()) {
      dot.append(pad).append(quote(idPrefix + state));
      if (!idPrefix.isEmpty() || state.equals(reset)) {
        dot.append(" [");
        if (!idPrefix.isEmpty()) {
          dot.append("label=").append(quote(state));
          if (state.equals(reset)) {
            dot.append(", ");
          }
        }
        if (state.equals(reset)) {
          dot.append("shape=doublecircle");
        }
        dot.append(']');
      }
      dot.append(";\n");
    }
    for (final TransitionEdge edge : graph.getTransitions()) {
      dot.append(pad).append(quote(idPrefix + edge.getFrom())).append(" -> ")
          .append(quote(idPrefix + edge.getTo()));
      if (!edge.isUnconditional()) {
        dot.append(" [label=").append(quote(edge.getGuard())).append(']');
      }
      dot.append(";\n");
    }
  }

  private static String graphName(final FsmGraph graph) {
    final String scope = graph.getScope().isEmpty() ? "" : graph.getScope() + ": ";
    return scope + graph.getStateVar();
  }

  static String quote(final String text) {
    return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
