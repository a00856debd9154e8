package com.github.automaton;

/**
 * The two semiring values that exist in every semiring: {@link #ZERO}, the identity for plus and
 * annihilator for times, and {@link #ONE}, the identity for times. They carry no state and belong
 * to no particular semiring, so they can be mixed with values of any {@link Semiring}
 * implementation.
 *
 * There are exactly two instances. Equality is semantic: ZERO equals any value that reports
 * {@link Semiring#isZero()}, and ONE equals any value that reports {@link Semiring#isOne()}.
 */
public final class Identity implements Semiring {
  public static final Identity ZERO = new Identity(false);
  public static final Identity ONE = new Identity(true);

  private static final int zeroHash = 0x2e40;
  private static final int oneHash = 0x3f80;

  private final boolean one;

  private Identity(final boolean one) {
    this.one = one;
  }

  /**
   * ONE + ONE throws {@link UnsupportedOperationException}: without a concrete semiring there's no
   * telling whether the sum is one or something else.
   */
  @Override
  public Semiring plus(final Semiring other) {
    if (!one) {
      return other;
    }
    if (other == ZERO) {
      return this;
    }
    if (other == ONE) {
      throw new UnsupportedOperationException(
          "<One> + <One> is undefined without a concrete semiring");
    }
    // plus is commutative, so let the concrete value decide
    return other.plus(this);
  }

  @Override
  public Semiring times(final Semiring other) {
    if (!one) {
      return ZERO;
    }
    return other;
  }

  @Override
  public boolean isZero() {
    return !one;
  }

  @Override
  public boolean isOne() {
    return one;
  }

  @Override
  public int hashCode() {
    return one ? oneHash : zeroHash;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Semiring)) {
      return false;
    }
    final Semiring other = (Semiring) obj;
    return one ? other.isOne() : other.isZero();
  }

  @Override
  public String toString() {
    return one ? "<One>" : "<Zero>";
  }
}
