package com.github.automaton;

/**
 * A value in a semiring. Arcs, terminal labels and shortest distances are all expressed as
 * semiring values.
 *
 * Notes for implementors:<br>
 * 1. {@link #plus(Semiring)} combines alternative paths and must be commutative, eg. choose the
 * cheaper of two costs.<br>
 *
 * 2. {@link #times(Semiring)} composes the weights of consecutive arcs along one path and must be
 * associative. It need not be commutative; the left operand always comes first on the path.<br>
 *
 * 3. every implementation has to interact with {@link Identity#ZERO} and {@link Identity#ONE}
 * without knowing anything else about them: x.plus(ZERO) is x, x.times(ONE) is x and x.times(ZERO)
 * is zero. The markers handle the mirrored cases themselves.<br>
 *
 * 4. a value that is semantically zero or one must report so through {@link #isZero()} and
 * {@link #isOne()}, must compare equal to the corresponding marker and must return the marker's
 * hashCode.<br>
 *
 * 5. values are immutable.<br>
 */
public interface Semiring {

  /**
   * Combine this with an alternative.
   */
  Semiring plus(final Semiring other);

  /**
   * Extend this with a following weight.
   */
  Semiring times(final Semiring other);

  /**
   * True iff this is the additive identity.
   */
  boolean isZero();

  /**
   * True iff this is the multiplicative identity.
   */
  boolean isOne();
}
