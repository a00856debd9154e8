package com.github.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A probability together with the symbol sequence that produced it. Plus keeps the more probable of
 * two alternatives, times multiplies probabilities and concatenates the symbols. Used with the
 * acyclic shortest distance, this turns it into the Viterbi algorithm: the distance to a state is
 * the most likely path there, along with its symbols.
 *
 * When both probabilities are equal, plus keeps the symbol sequence that comes first
 * lexicographically, so the result never depends on the order alternatives are combined in.
 */
public final class Viterbi implements Semiring {
  private final double probability;
  private final List<String> symbols;

  public Viterbi(final double probability) {
    this(probability, Collections.<String>emptyList());
  }

  public Viterbi(final double probability, final List<String> symbols) {
    if (!(probability >= 0.0)) {
      throw new IllegalArgumentException("Probability must be non-negative, not " + probability);
    }
    this.probability = probability;
    this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
  }

  public double getProbability() {
    return probability;
  }

  public List<String> getSymbols() {
    return symbols;
  }

  @Override
  public Semiring plus(final Semiring other) {
    if (other instanceof Identity) {
      if (other.isZero()) {
        return this;
      }
      return probability < 1.0 ? other : this;
    }
    final Viterbi that = asViterbi(other);
    if (probability != that.probability) {
      return probability < that.probability ? that : this;
    }
    return compare(symbols, that.symbols) <= 0 ? this : that;
  }

  @Override
  public Semiring times(final Semiring other) {
    if (other instanceof Identity) {
      return other.isZero() ? Identity.ZERO : this;
    }
    final Viterbi that = asViterbi(other);
    final List<String> concatenated = new ArrayList<>(symbols.size() + that.symbols.size());
    concatenated.addAll(symbols);
    concatenated.addAll(that.symbols);
    return new Viterbi(probability * that.probability, concatenated);
  }

  @Override
  public boolean isZero() {
    return probability == 0.0;
  }

  @Override
  public boolean isOne() {
    return probability == 1.0 && symbols.isEmpty();
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

  private static Viterbi asViterbi(final Semiring other) {
    if (!(other instanceof Viterbi)) {
      throw new IllegalArgumentException("Cannot combine Viterbi with " + other);
    }
    return (Viterbi) other;
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
    result = prime * result + Double.hashCode(probability);
    result = prime * result + symbols.hashCode();
    return result;
  }

  /**
   * Zero equals any zero-probability value regardless of its symbols.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj instanceof Identity) {
      return obj.equals(this);
    }
    if (!(obj instanceof Viterbi)) {
      return false;
    }
    final Viterbi other = (Viterbi) obj;
    if (isZero() || other.isZero()) {
      return isZero() && other.isZero();
    }
    return probability == other.probability && symbols.equals(other.symbols);
  }

  @Override
  public String toString() {
    return "Viterbi [probability=" + probability + ", symbols=" + symbols + "]";
  }
}
