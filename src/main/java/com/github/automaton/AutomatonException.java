package com.github.automaton;

/**
 * Unified single exception that's thrown by the automaton and its algorithms. The code enum
 * encapsulates the various error conditions; where a particular state is to blame, it is attached
 * and reported via {@link #getState()}.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final transient Object state;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.state = null;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.state = null;
  }

  public AutomatonException(final Code code, final String message, final Object state) {
    super(message);
    this.code = code;
    this.state = state;
  }

  public AutomatonException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
    this.state = null;
  }

  public Code getCode() {
    return code;
  }

  /**
   * The state that caused the failure, or null if no single state is to blame.
   */
  public Object getState() {
    return state;
  }

  public static enum Code {
    // 1.
    DUPLICATE_STATE("State exists already"),
    // 2.
    UNKNOWN_STATE("State not found"),
    // 3.
    CYCLE_DETECTED(
        "Automaton is not acyclic in the requested direction so no topological order exists"),
    // 4.
    INVALID_STATE("Null state is invalid"),
    // 5.
    INVALID_LABEL("Null label is invalid"),
    // 6.
    INVALID_AUTOMATON_CONFIG("Automaton configuration is invalid"),
    // 7.
    PARSE_FAILURE("Failed to parse automaton text input");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
