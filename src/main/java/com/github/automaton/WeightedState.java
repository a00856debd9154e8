package com.github.automaton;

import java.util.Objects;

/**
 * A state paired with a semiring value: a terminal label, an initial weight handed to the shortest
 * distance, or a shortest distance reported back.
 */
public final class WeightedState<S> {
  private final S state;
  private final Semiring label;

  private WeightedState(final S state, final Semiring label) {
    this.state = state;
    this.label = label;
  }

  public S getState() {
    return state;
  }

  public Semiring getLabel() {
    return label;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WeightedState)) {
      return false;
    }
    WeightedState<?> other = (WeightedState<?>) o;
    return Objects.equals(state, other.state) && Objects.equals(label, other.label);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, label);
  }

  @Override
  public String toString() {
    return "(" + state + ", " + label + ")";
  }

  public static <S> WeightedState<S> of(final S state, final Semiring label) {
    return new WeightedState<>(state, label);
  }
}
