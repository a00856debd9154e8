package com.github.automaton;

/**
 * This class encapsulates the configuration parameters for an Automaton. Use the
 * {@code AutomatonConfigurationBuilder} to build it.
 *
 * Both parameters are sizing hints only; they never limit how many states or arcs an automaton
 * can hold.
 *
 * Notes:<br>
 * 1. If expectedStates is not set, the state registry starts out sized for
 * {@link #defaultExpectedStates} states and grows as needed.<br>
 * 2. expectedArcsPerState sizes each per-state arc list when the state is added. Automata with
 * heavy fan-out can save on re-allocation by raising it.<br>
 */
public final class AutomatonConfiguration {
  static final int defaultExpectedStates = 16;
  static final int defaultExpectedArcsPerState = 4;

  private int expectedStates;
  private int expectedArcsPerState;

  public int getExpectedStates() {
    return expectedStates;
  }

  public int getExpectedArcsPerState() {
    return expectedArcsPerState;
  }

  /**
   * Configuration with all defaults.
   */
  public static AutomatonConfiguration defaults() {
    return new AutomatonConfiguration(0, 0);
  }

  public final static class AutomatonConfigurationBuilder {
    private int expectedStates;
    private int expectedArcsPerState;

    public static AutomatonConfigurationBuilder newBuilder() {
      return new AutomatonConfigurationBuilder();
    }

    public AutomatonConfigurationBuilder expectedStates(final int expectedStates) {
      this.expectedStates = expectedStates;
      return this;
    }

    public AutomatonConfigurationBuilder expectedArcsPerState(final int expectedArcsPerState) {
      this.expectedArcsPerState = expectedArcsPerState;
      return this;
    }

    public AutomatonConfiguration build() throws AutomatonException {
      validate(expectedStates, expectedArcsPerState);
      return new AutomatonConfiguration(expectedStates, expectedArcsPerState);
    }

    private AutomatonConfigurationBuilder() {}
  }

  private static void validate(final int expectedStates, final int expectedArcsPerState)
      throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (expectedStates < 0) {
      messages.append("expectedStates cannot be negative. ");
    }
    if (expectedArcsPerState < 0) {
      messages.append("expectedArcsPerState cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_AUTOMATON_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [expectedStates=" + expectedStates + ", expectedArcsPerState="
        + expectedArcsPerState + "]";
  }

  // 0 means unset and falls back on the defaults
  private AutomatonConfiguration(final int expectedStates, final int expectedArcsPerState) {
    this.expectedStates = expectedStates == 0 ? defaultExpectedStates : expectedStates;
    this.expectedArcsPerState =
        expectedArcsPerState == 0 ? defaultExpectedArcsPerState : expectedArcsPerState;
  }

}
