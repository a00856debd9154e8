package com.github.automaton;

import java.util.Objects;

public final class TraversedState<S> {
  private final S state;
  private final TraversalEvent event;

  TraversedState(final S state, final TraversalEvent event) {
    this.state = state;
    this.event = event;
  }

  public S getState() {
    return state;
  }

  public TraversalEvent getEvent() {
    return event;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TraversedState)) {
      return false;
    }
    TraversedState<?> other = (TraversedState<?>) o;
    return Objects.equals(state, other.state) && event == other.event;
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, event);
  }

  @Override
  public String toString() {
    return "TraversedState [state=" + state + ", event=" + event + "]";
  }
}
