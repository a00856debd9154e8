package com.github.automaton;

/**
 * An immutable arc from a source state to a target state, labelled with a semiring value. Arcs are
 * created by {@link Automaton#addArc(Object, Object, Semiring)} and owned by the automaton.
 */
public final class Arc<S> {
  private final S source;
  private final S target;
  private final Semiring label;

  Arc(final S source, final S target, final Semiring label) {
    this.source = source;
    this.target = target;
    this.label = label;
  }

  public S getSource() {
    return source;
  }

  public S getTarget() {
    return target;
  }

  /**
   * The state this arc leads to when it is followed in the given direction: the target going
   * forward, the source going backward.
   */
  public S getState(final Direction direction) {
    return direction == Direction.FORWARD ? target : source;
  }

  /**
   * Flag form of {@link #getState(Direction)}: true selects the target, false the source.
   */
  public S getState(final boolean end) {
    return getState(Direction.of(end));
  }

  public Semiring getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return "Arc [source=" + source + ", target=" + target + ", label=" + label + "]";
  }
}
