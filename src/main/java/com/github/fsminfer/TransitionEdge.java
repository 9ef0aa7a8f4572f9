package com.github.fsminfer;

import java.util.Objects;

/**
 * One (from, to, guard) edge of an FSM graph. The guard is an opaque expression string or
 * {@link #UNCONDITIONAL}.
 */
public final class TransitionEdge {
  public static final String UNCONDITIONAL = "1";

  private final String from;
  private final String to;
  private final String guard;

  public TransitionEdge(final String from, final String to, final String guard) {
    this.from = from;
    this.to = to;
    this.guard = guard == null || guard.trim().isEmpty() ? UNCONDITIONAL : guard.trim();
  }

  public static TransitionEdge unconditional(final String from, final String to) {
    return new TransitionEdge(from, to, UNCONDITIONAL);
  }

  public String getFrom() {
    return from;
  }

  public String getTo() {
    return to;
  }

  public String getGuard() {
    return guard;
  }

  public boolean isUnconditional() {
    return UNCONDITIONAL.equals(guard);
  }

  /**
   * Guard with all whitespace removed, for comparing guards across a print/re-parse cycle.
   */
  public String normalizedGuard() {
    return SyntaxTrees.compact(guard);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionEdge)) {
      return false;
    }
    TransitionEdge edge = (TransitionEdge) o;
    return Objects.equals(from, edge.from) && Objects.equals(to, edge.to)
        && Objects.equals(guard, edge.guard);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to, guard);
  }

  @Override
  public String toString() {
    return "(" + from + "->" + to + ", " + guard + ")";
  }
}
