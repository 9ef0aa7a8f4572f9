package com.github.fsminfer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a possibly hand-edited {@link FsmGraph} back into a synthesizable SystemVerilog module.
 * 
 * Layout of the generated module:<br>
 * 1. an enum typedef keeping the state order, sized to the smallest width holding every state<br>
 * 2. the state register and, for two-process graphs, the next-state variable<br>
 * 3. a clocked block with an asynchronous reset branch<br>
 * 4. the next-state case: unconditional edges of a state first, then its guarded edges as an
 * if/else-if chain in edge order; a state without edges holds<br>
 * 
 * Single-process graphs carry the case inside the clocked block. Output is a pure function of the
 * graph, the module name and the hints.
 */
public final class FsmCodeGenerator {
  private static final Logger logger = LogManager.getLogger(FsmCodeGenerator.class.getSimpleName());

  static final String DEFAULT_MODULE_NAME = "fsm_example";
  private static final String INDENT = "  ";
  private static final Pattern GUARD_IDENTIFIER =
      Pattern.compile("(?<![\\w'$])[A-Za-z_][\\w$]*");

  private FsmCodeGenerator() {}

  /**
   * Checks the preconditions of generation, failing on the first violation found.
   */
  public static void validate(final FsmGraph graph) throws ValidationFailure {
    if (graph == null) {
      throw new ValidationFailure("graph", "null", "Graph is required");
    }
    if (isBlank(graph.getStateVar())) {
      throw new ValidationFailure("state_var", String.valueOf(graph.getStateVar()),
          "State variable name is required");
    }
    if (graph.getNextStateVar().isPresent()) {
      final String next = graph.getNextStateVar().get();
      if (isBlank(next)) {
        throw new ValidationFailure("next_state_var", next, "Next-state variable name is blank");
      }
      if (next.equals(graph.getStateVar())) {
        throw new ValidationFailure("next_state_var", next,
            "Next-state variable must differ from the state variable");
      }
    }
    if (isBlank(graph.getEnumName())) {
      throw new ValidationFailure("enum_name", String.valueOf(graph.getEnumName()),
          "Enum name is required");
    }
    final List<String> states = graph.getStates();
    if (states.isEmpty()) {
      throw new ValidationFailure("states", "[]", "Graph has no states");
    }
    final Set<String> seen = new HashSet<>();
    for (final String state : states) {
      if (isBlank(state)) {
        throw new ValidationFailure("states", String.valueOf(state), "Blank state name");
      }
      if (!seen.add(state)) {
        throw new ValidationFailure("states", state, "Duplicate state");
      }
    }
    final List<TransitionEdge> transitions = graph.getTransitions();
    for (int iter = 0; iter < transitions.size(); iter++) {
      final TransitionEdge edge = transitions.get(iter);
      if (!seen.contains(edge.getFrom())) {
        throw new ValidationFailure("transitions[" + iter + "].from",
            String.valueOf(edge.getFrom()), "Transition from unknown state");
      }
      if (!seen.contains(edge.getTo())) {
        throw new ValidationFailure("transitions[" + iter + "].to", String.valueOf(edge.getTo()),
            "Transition to unknown state");
      }
    }
    if (graph.getResetState().isPresent() && !seen.contains(graph.getResetState().get())) {
      throw new ValidationFailure("reset_state", graph.getResetState().get(),
          "Reset state is not one of the states");
    }
  }

  /**
   * Generates the module. A null or empty targetName derives the name from the graph scope.
   */
  public static String generate(final FsmGraph graph, final String targetName,
      final SourceHints hints) throws ValidationFailure {
    validate(graph);
    if (targetName != null && !targetName.isEmpty()
        && !FsmEngineConfiguration.isIdentifier(targetName)) {
      throw new ValidationFailure("target_name", targetName, "Module name is not an identifier");
    }
    final String moduleName = targetName == null || targetName.isEmpty()
        ? moduleNameOf(graph.getScope()) : targetName;
    final SourceHints effectiveHints = hints == null ? SourceHints.defaults() : hints;

    final StringBuilder source = new StringBuilder();
    header(source, moduleName, graph, effectiveHints);
    source.append('\n');
    enumDeclaration(source, graph);
    source.append('\n');
    variableDeclarations(source, graph);
    source.append('\n');
    if (graph.getNextStateVar().isPresent()) {
      clockedBlock(source, graph, effectiveHints, false);
      source.append('\n');
      combinationalBlock(source, graph);
    } else {
      clockedBlock(source, graph, effectiveHints, true);
    }
    source.append('\n');
    source.append("endmodule : ").append(moduleName).append('\n');
    if (logger.isDebugEnabled()) {
      logger.debug("Generated module " + moduleName + " for " + graph.getNumStates()
          + " states and " + graph.getNumTransitions() + " transitions");
    }
    return source.toString();
  }

  /**
   * Smallest bit width able to encode the given number of states, at least 1.
   */
  static int bitWidth(final int numStates) {
    return Math.max(1, 32 - Integer.numberOfLeadingZeros(numStates - 1));
  }

  static String moduleNameOf(final String scope) {
    if (scope == null || scope.trim().isEmpty()) {
      return DEFAULT_MODULE_NAME;
    }
    final String[] words = scope.trim().split("\\s+");
    final String last = words[words.length - 1];
    return words.length > 1 && FsmEngineConfiguration.isIdentifier(last) ? last
        : DEFAULT_MODULE_NAME;
  }

  /**
   * Identifiers read by the guards, in first-use order, minus states, state variables and the
   * clock/reset ports.
   */
  static List<String> guardInputs(final FsmGraph graph, final SourceHints hints) {
    final Set<String> excluded = new HashSet<>(graph.getStates());
    excluded.add(graph.getStateVar());
    excluded.add(graph.getEnumName());
    if (graph.getNextStateVar().isPresent()) {
      excluded.add(graph.getNextStateVar().get());
    }
    excluded.add(hints.getClockSignal());
    excluded.add(hints.getResetSignal());
    final Set<String> inputs = new LinkedHashSet<>();
    for (final TransitionEdge edge : graph.getTransitions()) {
      if (edge.isUnconditional()) {
        continue;
      }
      final Matcher matcher = GUARD_IDENTIFIER.matcher(edge.getGuard());
      while (matcher.find()) {
        if (!excluded.contains(matcher.group())) {
          inputs.add(matcher.group());
        }
      }
    }
    return new ArrayList<>(inputs);
  }

  private static void header(final StringBuilder source, final String moduleName,
      final FsmGraph graph, final SourceHints hints) {
    final List<String> ports = new ArrayList<>();
    ports.add(hints.getClockSignal());
    ports.add(hints.getResetSignal());
    ports.addAll(guardInputs(graph, hints));
    source.append("module ").append(moduleName).append(" (\n");
    for (int iter = 0; iter < ports.size(); iter++) {
      source.append(INDENT).append("input logic ").append(ports.get(iter));
      source.append(iter + 1 < ports.size() ? ",\n" : "\n");
    }
    source.append(");\n");
  }

  private static void enumDeclaration(final StringBuilder source, final FsmGraph graph) {
    final List<String> states = graph.getStates();
    source.append(INDENT).append("typedef enum logic [").append(bitWidth(states.size()) - 1)
        .append(":0] {\n");
    for (int iter = 0; iter < states.size(); iter++) {
      source.append(INDENT).append(INDENT).append(states.get(iter));
      source.append(iter + 1 < states.size() ? ",\n" : "\n");
    }
    source.append(INDENT).append("} ").append(graph.getEnumName()).append(";\n");
  }

  private static void variableDeclarations(final StringBuilder source, final FsmGraph graph) {
    source.append(INDENT).append(graph.getEnumName()).append(' ').append(graph.getStateVar());
    if (graph.getNextStateVar().isPresent()) {
      source.append(", ").append(graph.getNextStateVar().get());
    }
    source.append(";\n");
  }

  private static void clockedBlock(final StringBuilder source, final FsmGraph graph,
      final SourceHints hints, final boolean withCase) {
    final String state = graph.getStateVar();
    final String resetEdge = hints.isResetActiveLow() ? "negedge" : "posedge";
    final String resetCondition =
        hints.isResetActiveLow() ? "!" + hints.getResetSignal() : hints.getResetSignal();
    source.append(INDENT).append("always_ff @(posedge ").append(hints.getClockSignal())
        .append(" or ").append(resetEdge).append(' ').append(hints.getResetSignal())
        .append(") begin\n");
    source.append(INDENT).append(INDENT).append("if (").append(resetCondition)
        .append(") begin\n");
    source.append(INDENT).append(INDENT).append(INDENT).append(state).append(" <= ")
        .append(graph.getResetState().orElse(state)).append(";\n");
    source.append(INDENT).append(INDENT).append("end else begin\n");
    if (withCase) {
      caseStatement(source, graph, state, "<=", 3);
    } else {
      source.append(INDENT).append(INDENT).append(INDENT).append(state).append(" <= ")
          .append(graph.getNextStateVar().get()).append(";\n");
    }
    source.append(INDENT).append(INDENT).append("end\n");
    source.append(INDENT).append("end\n");
  }

  private static void combinationalBlock(final StringBuilder source, final FsmGraph graph) {
    final String next = graph.getNextStateVar().get();
    source.append(INDENT).append("always_comb begin\n");
    source.append(INDENT).append(INDENT).append(next).append(" = ").append(graph.getStateVar())
        .append(";\n");
    caseStatement(source, graph, next, "=", 2);
    source.append(INDENT).append("end\n");
  }

  private static void caseStatement(final StringBuilder source, final FsmGraph graph,
      final String target, final String operator, final int depth) {
    final Map<String, List<TransitionEdge>> byState = new LinkedHashMap<>();
    for (final String state : graph.getStates()) {
      byState.put(state, new ArrayList<TransitionEdge>());
    }
    for (final TransitionEdge edge : graph.getTransitions()) {
      byState.get(edge.getFrom()).add(edge);
    }
    final String pad = indent(depth);
    final String hold = target + " " + operator + " " + graph.getStateVar() + ";\n";
    source.append(pad).append("case (").append(graph.getStateVar()).append(")\n");
    for (final Map.Entry<String, List<TransitionEdge>> entry : byState.entrySet()) {
      source.append(pad).append(INDENT).append(entry.getKey()).append(": begin\n");
      final String body = pad + INDENT + INDENT;
      if (entry.getValue().isEmpty()) {
        source.append(body).append(hold);
      }
      for (final TransitionEdge edge : entry.getValue()) {
        if (edge.isUnconditional()) {
          source.append(body).append(target).append(' ').append(operator).append(' ')
              .append(edge.getTo()).append(";\n");
        }
      }
      boolean first = true;
      for (final TransitionEdge edge : entry.getValue()) {
        if (edge.isUnconditional()) {
          continue;
        }
        if (first) {
          source.append(body).append("if (");
          first = false;
        } else {
          source.append(" else if (");
        }
        source.append(edge.getGuard().trim()).append(") begin\n");
        source.append(body).append(INDENT).append(target).append(' ').append(operator)
            .append(' ').append(edge.getTo()).append(";\n");
        source.append(body).append("end");
      }
      if (!first) {
        source.append('\n');
      }
      source.append(pad).append(INDENT).append("end\n");
    }
    source.append(pad).append(INDENT).append("default: ").append(hold);
    source.append(pad).append("endcase\n");
  }

  private static String indent(final int depth) {
    final StringBuilder pad = new StringBuilder();
    for (int iter = 0; iter < depth; iter++) {
      pad.append(INDENT);
    }
    return pad.toString();
  }

  private static boolean isBlank(final String value) {
    return value == null || value.trim().isEmpty();
  }
}
