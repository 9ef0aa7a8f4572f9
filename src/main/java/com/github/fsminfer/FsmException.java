package com.github.fsminfer;

/**
 * Unified checked exception of the engine. The code enum encapsulates the failure condition; an
 * absent FSM is never reported through this exception, it is an empty result.
 */
public class FsmException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FsmException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FsmException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FsmException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_ENGINE_CONFIG("Engine configuration is invalid"),
    // 2.
    INVALID_GRAPH("FSM graph failed validation and cannot be turned into source"),
    // 3.
    MALFORMED_GRAPH_RECORD("FSM graph record is malformed or misses a required field"),
    // 4.
    MALFORMED_TREE_RECORD("Syntax tree record is malformed or misses a required field"),
    // 5.
    UNKNOWN_FAILURE("Engine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
