package com.github.automaton;

/**
 * The tropical semiring: plus chooses the lower of two costs, times adds costs. Zero is an infinite
 * cost (no path), one is a cost of 0 (the empty path). With this semiring the acyclic shortest
 * distance is the classical shortest path.
 */
public final class Cost implements Semiring {
  private final double value;

  public Cost(final double value) {
    this.value = value;
  }

  public double getValue() {
    return value;
  }

  @Override
  public Semiring plus(final Semiring other) {
    if (other instanceof Identity) {
      return other.isZero() ? this : new Cost(Math.min(value, 0.0));
    }
    return new Cost(Math.min(value, asCost(other).value));
  }

  @Override
  public Semiring times(final Semiring other) {
    if (other instanceof Identity) {
      return other.isZero() ? new Cost(Double.POSITIVE_INFINITY) : this;
    }
    return new Cost(value + asCost(other).value);
  }

  @Override
  public boolean isZero() {
    return value == Double.POSITIVE_INFINITY;
  }

  @Override
  public boolean isOne() {
    return value == 0.0;
  }

  private static Cost asCost(final Semiring other) {
    if (!(other instanceof Cost)) {
      throw new IllegalArgumentException("Cannot combine Cost with " + other);
    }
    return (Cost) other;
  }

  @Override
  public int hashCode() {
    if (isZero()) {
      return Identity.ZERO.hashCode();
    }
    if (isOne()) {
      return Identity.ONE.hashCode();
    }
    return Double.hashCode(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj instanceof Identity) {
      return obj.equals(this);
    }
    if (!(obj instanceof Cost)) {
      return false;
    }
    return value == ((Cost) obj).value;
  }

  @Override
  public String toString() {
    return "Cost [value=" + value + "]";
  }
}
