package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * This object represents one inferred finite state machine: its states in declaration order, its
 * reset state and its deduplicated transition edges.
 * 
 * A graph is immutable. Callers that want to edit one take a {@link #toBuilder()} copy, change it
 * and hand the result to the code generator; the engine never mutates a graph it returned.
 */
public final class FsmGraph {
  private final String scope;
  private final String stateVar;
  private final String nextStateVar;
  private final String enumName;
  private final List<String> states;
  private final String resetState;
  private final List<TransitionEdge> transitions;

  /**
   * Process layout of the machine: a separate combinational next-state process, or a single
   * clocked process updating the register directly.
   */
  public static enum Style {
    TWO_PROCESS, SINGLE_PROCESS;
  }

  private FsmGraph(final FsmGraphBuilder builder) {
    this.scope = builder.scope;
    this.stateVar = builder.stateVar;
    this.nextStateVar = builder.nextStateVar;
    this.enumName = builder.enumName;
    this.states = Collections.unmodifiableList(new ArrayList<>(builder.states));
    this.resetState = builder.resetState;
    this.transitions =
        Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(builder.transitions)));
  }

  public String getScope() {
    return scope;
  }

  public String getStateVar() {
    return stateVar;
  }

  public Optional<String> getNextStateVar() {
    return Optional.ofNullable(nextStateVar);
  }

  public String getEnumName() {
    return enumName;
  }

  /**
   * States in enum declaration order.
   */
  public List<String> getStates() {
    return states;
  }

  public Optional<String> getResetState() {
    return Optional.ofNullable(resetState);
  }

  public List<TransitionEdge> getTransitions() {
    return transitions;
  }

  public int getNumStates() {
    return states.size();
  }

  public int getNumTransitions() {
    return transitions.size();
  }

  public Style getStyle() {
    return nextStateVar == null ? Style.SINGLE_PROCESS : Style.TWO_PROCESS;
  }

  public FsmGraphBuilder toBuilder() {
    final FsmGraphBuilder builder = FsmGraphBuilder.newBuilder().scope(scope).stateVar(stateVar)
        .nextStateVar(nextStateVar).enumName(enumName).resetState(resetState);
    builder.states.addAll(states);
    builder.transitions.addAll(transitions);
    return builder;
  }

  @Override
  public int hashCode() {
    return Objects.hash(scope, stateVar, nextStateVar, enumName, states, resetState, transitions);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FsmGraph)) {
      return false;
    }
    final FsmGraph other = (FsmGraph) obj;
    return Objects.equals(scope, other.scope) && Objects.equals(stateVar, other.stateVar)
        && Objects.equals(nextStateVar, other.nextStateVar)
        && Objects.equals(enumName, other.enumName) && Objects.equals(states, other.states)
        && Objects.equals(resetState, other.resetState)
        && Objects.equals(transitions, other.transitions);
  }

  @Override
  public String toString() {
    return "FsmGraph [scope=" + scope + ", stateVar=" + stateVar + ", nextStateVar="
        + nextStateVar + ", enumName=" + enumName + ", states=" + states + ", resetState="
        + resetState + ", transitions=" + transitions + "]";
  }

  /**
   * A simple builder to let users use fluent APIs to build or edit graphs. Duplicate edges collapse
   * on build; nothing else is checked here, see {@link FsmCodeGenerator#validate(FsmGraph)}.
   */
  public final static class FsmGraphBuilder {
    private String scope = "";
    private String stateVar;
    private String nextStateVar;
    private String enumName;
    private final List<String> states = new ArrayList<>();
    private String resetState;
    private final List<TransitionEdge> transitions = new ArrayList<>();

    public static FsmGraphBuilder newBuilder() {
      return new FsmGraphBuilder();
    }

    public FsmGraphBuilder scope(final String scope) {
      this.scope = scope == null ? "" : scope;
      return this;
    }

    public FsmGraphBuilder stateVar(final String stateVar) {
      this.stateVar = stateVar;
      return this;
    }

    public FsmGraphBuilder nextStateVar(final String nextStateVar) {
      this.nextStateVar = nextStateVar;
      return this;
    }

    public FsmGraphBuilder enumName(final String enumName) {
      this.enumName = enumName;
      return this;
    }

    public FsmGraphBuilder state(final String state) {
      this.states.add(state);
      return this;
    }

    public FsmGraphBuilder states(final List<String> states) {
      this.states.clear();
      this.states.addAll(states);
      return this;
    }

    public FsmGraphBuilder resetState(final String resetState) {
      this.resetState = resetState;
      return this;
    }

    public FsmGraphBuilder transition(final String from, final String to, final String guard) {
      this.transitions.add(new TransitionEdge(from, to, guard));
      return this;
    }

    public FsmGraphBuilder transition(final TransitionEdge edge) {
      this.transitions.add(edge);
      return this;
    }

    public FsmGraphBuilder transitions(final List<TransitionEdge> transitions) {
      this.transitions.clear();
      this.transitions.addAll(transitions);
      return this;
    }

    public FsmGraphBuilder removeTransition(final TransitionEdge edge) {
      this.transitions.remove(edge);
      return this;
    }

    public FsmGraph build() {
      return new FsmGraph(this);
    }

    private FsmGraphBuilder() {}
  }
}
