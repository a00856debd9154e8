package com.github.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Read-only view of an automaton whose arc and terminal labels are passed through a function as
 * they are read. The structure (states, arcs, their order) is the underlying automaton's, so
 * traversals and topological orders are simply delegated.
 */
final class TransformedAutomaton<S> implements Automaton<S> {
  private final AutomatonImpl<S> automaton;
  private final Function<Semiring, Semiring> function;

  TransformedAutomaton(final AutomatonImpl<S> automaton,
      final Function<Semiring, Semiring> function) {
    this.automaton = automaton;
    this.function = function;
  }

  // the markers belong to every semiring
  private Semiring transform(final Semiring label) {
    if (label == Identity.ZERO || label == Identity.ONE) {
      return label;
    }
    final Semiring transformed = function.apply(label);
    if (transformed == null) {
      throw new IllegalStateException("Label function returned null for " + label);
    }
    return transformed;
  }

  @Override
  public boolean hasState(final S state) {
    return automaton.hasState(state);
  }

  @Override
  public void addState(final S state) {
    throw new UnsupportedOperationException("Cannot add state " + state + " to a label view");
  }

  @Override
  public List<S> states() {
    return automaton.states();
  }

  @Override
  public void addArc(final S source, final S target, final Semiring label) {
    throw new UnsupportedOperationException(
        "Cannot add arc " + source + "->" + target + " to a label view");
  }

  @Override
  public List<Arc<S>> arcsOn(final Direction direction, final S state) throws AutomatonException {
    final List<Arc<S>> arcs = automaton.arcsOn(direction, state);
    final List<Arc<S>> transformed = new ArrayList<>(arcs.size());
    for (final Arc<S> arc : arcs) {
      transformed.add(new Arc<>(arc.getSource(), arc.getTarget(), transform(arc.getLabel())));
    }
    return Collections.unmodifiableList(transformed);
  }

  @Override
  public void setTerminalLabel(final Direction direction, final S state, final Semiring label) {
    throw new UnsupportedOperationException(
        "Cannot set terminal label of " + state + " on a label view");
  }

  @Override
  public Semiring getTerminalLabel(final Direction direction, final S state)
      throws AutomatonException {
    return transform(automaton.getTerminalLabel(direction, state));
  }

  @Override
  public List<WeightedState<S>> terminalStates(final Direction direction) {
    final List<WeightedState<S>> terminalStates = new ArrayList<>();
    for (final WeightedState<S> terminalState : automaton.terminalStates(direction)) {
      final Semiring label = transform(terminalState.getLabel());
      if (!label.isZero()) {
        terminalStates.add(WeightedState.of(terminalState.getState(), label));
      }
    }
    return Collections.unmodifiableList(terminalStates);
  }

  @Override
  public Iterator<TraversedState<S>> traverse(final Direction direction) {
    return automaton.traverse(direction);
  }

  @Override
  public List<S> topologicalOrder() throws AutomatonException {
    return automaton.topologicalOrder();
  }

  @Override
  public List<S> topologicalOrder(final Direction direction) throws AutomatonException {
    return automaton.topologicalOrder(direction);
  }

  @Override
  public Iterator<WeightedState<S>> shortestDistanceAcyclicFrom(final S state)
      throws AutomatonException {
    return shortestDistanceAcyclicFrom(state, Direction.FORWARD);
  }

  @Override
  public Iterator<WeightedState<S>> shortestDistanceAcyclicFrom(final S state,
      final Direction direction) throws AutomatonException {
    return shortestDistanceAcyclic(
        Collections.singletonList(WeightedState.of(state, Identity.ONE)), direction);
  }

  @Override
  public Iterator<WeightedState<S>> shortestDistanceAcyclic(
      final Iterable<WeightedState<S>> initialStates) throws AutomatonException {
    return shortestDistanceAcyclic(initialStates, Direction.FORWARD);
  }

  /**
   * The initial weights are taken as they are: they already belong to the transformed semiring.
   */
  @Override
  public Iterator<WeightedState<S>> shortestDistanceAcyclic(
      final Iterable<WeightedState<S>> initialStates, final Direction direction)
      throws AutomatonException {
    return automaton.shortestDistanceAcyclic(initialStates, direction,
        new Function<Semiring, Semiring>() {
          @Override
          public Semiring apply(final Semiring label) {
            return transform(label);
          }
        });
  }

  /**
   * Stacks the given function on top of this one, still over the same underlying automaton.
   */
  @Override
  public Automaton<S> transformLabels(final Function<Semiring, Semiring> next) {
    if (next == null) {
      throw new IllegalArgumentException("Label function cannot be null");
    }
    return new TransformedAutomaton<>(automaton, new Function<Semiring, Semiring>() {
      @Override
      public Semiring apply(final Semiring label) {
        return next.apply(transform(label));
      }
    });
  }

  @Override
  public String getId() {
    return automaton.getId();
  }

  @Override
  public AutomatonConfiguration getConfiguration() {
    return automaton.getConfiguration();
  }

  @Override
  public AutomatonStatistics getStatistics() {
    return automaton.getStatistics();
  }

}
