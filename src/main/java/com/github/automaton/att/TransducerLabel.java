package com.github.automaton.att;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.automaton.Identity;
import com.github.automaton.Semiring;

/**
 * Label of a weighted transducer: an input symbol sequence, an output symbol sequence and a cost.
 * Times concatenates both tapes and adds the costs. Plus keeps the alternative with the lower cost;
 * on equal costs the one whose input, then output, comes first lexicographically wins, so that plus
 * is commutative.
 */
public final class TransducerLabel implements Semiring {
  private static final TransducerLabel one =
      new TransducerLabel(Collections.<String>emptyList(), Collections.<String>emptyList(), 0.0);

  private final List<String> input;
  private final List<String> output;
  private final double cost;

  public TransducerLabel(final List<String> input, final List<String> output, final double cost) {
    this.input = Collections.unmodifiableList(new ArrayList<>(input));
    this.output = Collections.unmodifiableList(new ArrayList<>(output));
    // -0.0 and 0.0 must hash alike
    this.cost = cost + 0.0;
  }

  /**
   * Empty tapes at no cost.
   */
  public static TransducerLabel one() {
    return one;
  }

  public List<String> getInput() {
    return input;
  }

  public List<String> getOutput() {
    return output;
  }

  public double getCost() {
    return cost;
  }

  @Override
  public Semiring plus(final Semiring other) {
    if (other instanceof Identity) {
      return other.isZero() ? this : plus(one);
    }
    final TransducerLabel that = asTransducerLabel(other);
    if (cost != that.cost) {
      return cost < that.cost ? this : that;
    }
    int comparison = compare(input, that.input);
    if (comparison == 0) {
      comparison = compare(output, that.output);
    }
    return comparison <= 0 ? this : that;
  }

  @Override
  public Semiring times(final Semiring other) {
    if (other instanceof Identity) {
      return other.isZero() ? Identity.ZERO : this;
    }
    final TransducerLabel that = asTransducerLabel(other);
    return new TransducerLabel(concatenate(input, that.input), concatenate(output, that.output),
        cost + that.cost);
  }

  @Override
  public boolean isZero() {
    return cost == Double.POSITIVE_INFINITY;
  }

  @Override
  public boolean isOne() {
    return cost == 0.0 && input.isEmpty() && output.isEmpty();
  }

  private static TransducerLabel asTransducerLabel(final Semiring other) {
    if (!(other instanceof TransducerLabel)) {
      throw new IllegalArgumentException("Cannot combine TransducerLabel with " + other);
    }
    return (TransducerLabel) other;
  }

  private static List<String> concatenate(final List<String> left, final List<String> right) {
    final List<String> result = new ArrayList<>(left.size() + right.size());
    result.addAll(left);
    result.addAll(right);
    return result;
  }

  // lexicographic; a proper prefix comes first
  private static int compare(final List<String> left, final List<String> right) {
    final int common = Math.min(left.size(), right.size());
    for (int i = 0; i < common; i++) {
      final int comparison = left.get(i).compareTo(right.get(i));
      if (comparison != 0) {
        return comparison;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  @Override
  public int hashCode() {
    if (isZero()) {
      return Identity.ZERO.hashCode();
    }
    if (isOne()) {
      return Identity.ONE.hashCode();
    }
    final int prime = 31;
    int result = 1;
    result = prime * result + Double.hashCode(cost);
    result = prime * result + input.hashCode();
    result = prime * result + output.hashCode();
    return result;
  }

  /**
   * All labels with infinite cost are equal, whatever their tapes.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj instanceof Identity) {
      return obj.equals(this);
    }
    if (!(obj instanceof TransducerLabel)) {
      return false;
    }
    final TransducerLabel other = (TransducerLabel) obj;
    if (isZero() || other.isZero()) {
      return isZero() && other.isZero();
    }
    return cost == other.cost && input.equals(other.input) && output.equals(other.output);
  }

  @Override
  public String toString() {
    return "TransducerLabel [input=" + input + ", output=" + output + ", cost=" + cost + "]";
  }
}
