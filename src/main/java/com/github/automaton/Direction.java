package com.github.automaton;

/**
 * The direction in which an automaton is read.
 */
public enum Direction {
  // follow arcs from source to target; on terminal labels, the initial side
  FORWARD,
  // follow arcs from target to source; on terminal labels, the final side
  BACKWARD;

  /**
   * Maps the boolean direction flag: true is forward, false is backward.
   */
  public static Direction of(final boolean forward) {
    return forward ? FORWARD : BACKWARD;
  }

  /**
   * Extends a path weight by one more arc. Going forward the arc is appended on the right; going
   * backward the path is walked from its end, so the arc goes on the left. Either way the product
   * reads in path order, which matters for non-commutative semirings.
   */
  Semiring extend(final Semiring pathWeight, final Semiring arcLabel) {
    return this == FORWARD ? pathWeight.times(arcLabel) : arcLabel.times(pathWeight);
  }
}
