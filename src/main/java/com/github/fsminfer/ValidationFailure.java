package com.github.fsminfer;

/**
 * Raised when a graph handed to the code generator breaks one of its preconditions. Names the
 * offending field and value; the graph is never repaired.
 */
public final class ValidationFailure extends FsmException {
  private static final long serialVersionUID = 1L;
  private final String field;
  private final String value;

  public ValidationFailure(final String field, final String value, final String message) {
    super(Code.INVALID_GRAPH, message + " [field=" + field + ", value=" + value + "]");
    this.field = field;
    this.value = value;
  }

  /**
   * Record field that failed, eg. "states", "transitions[2].to", "reset_state".
   */
  public String getField() {
    return field;
  }

  public String getValue() {
    return value;
  }
}
