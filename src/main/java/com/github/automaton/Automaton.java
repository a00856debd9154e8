package com.github.automaton;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * A weighted finite-state automaton: a directed multigraph over client-supplied states whose arcs
 * are labelled with semiring values, with an initial and a final label on every state.
 *
 * Notes for users:<br>
 * 1. states can be any object with sensible equals() and hashCode(); they are never compared or
 * ordered, only looked up. Every enumeration comes back in the order states, arcs and labels were
 * added.<br>
 *
 * 2. the automaton only grows: states and arcs can be added but not removed. Queries never modify
 * it and can be repeated at will.<br>
 *
 * 3. this automaton is not thread-safe. Concurrent queries are fine as long as nobody is adding to
 * it at the same time; lazy results must not outlive a modification.<br>
 *
 * 4. the semiring is whatever the labels say. The automaton does not check that all labels come
 * from the same semiring; mixing them fails once two of them are combined.<br>
 *
 * 5. wherever a direction is asked for, FORWARD reads arcs from source to target and refers to the
 * initial labels, BACKWARD reads them from target to source and refers to the final labels.<br>
 */
public interface Automaton<S> {

  ///// States /////
  boolean hasState(final S state);

  /**
   * Add a new state. Fails if the state is there already, and leaves the automaton unchanged.
   */
  void addState(final S state) throws AutomatonException;

  /**
   * All states in the order they were added. The returned list is a read-only view.
   */
  List<S> states();


  ///// Arcs /////
  /**
   * Add an arc from source to target. Both states must exist. Any number of arcs may connect the
   * same two states, and an arc may lead from a state to itself.
   */
  void addArc(final S source, final S target, final Semiring label) throws AutomatonException;

  /**
   * The arcs with the state at the end implied by the direction: leaving it going forward, arriving
   * at it going backward. In the order they were added.
   */
  List<Arc<S>> arcsOn(final Direction direction, final S state) throws AutomatonException;


  ///// Terminal labels /////
  /**
   * Set the initial (forward) or final (backward) label of a state. Setting it to zero makes the
   * state non-initial or non-final again.
   */
  void setTerminalLabel(final Direction direction, final S state, final Semiring label)
      throws AutomatonException;

  /**
   * Returns {@link Identity#ZERO} for a state whose label was never set.
   */
  Semiring getTerminalLabel(final Direction direction, final S state) throws AutomatonException;

  /**
   * States with a non-zero initial (forward) or final (backward) label, in the order their labels
   * were first set.
   */
  List<WeightedState<S>> terminalStates(final Direction direction);


  ///// Algorithms /////
  /**
   * Depth-first traversal over the whole automaton, lazily reporting what happens to each state.
   * Roots are tried in insertion order and arcs followed in add order.
   */
  Iterator<TraversedState<S>> traverse(final Direction direction);

  /**
   * All states in forward topological order: every arc goes from a state to a later one.
   */
  List<S> topologicalOrder() throws AutomatonException;

  /**
   * All states in topological order for the given direction. Fails with
   * {@link AutomatonException.Code#CYCLE_DETECTED} if there is none.
   */
  List<S> topologicalOrder(final Direction direction) throws AutomatonException;

  /**
   * Forward shortest distance from a single state with initial weight {@link Identity#ONE}.
   */
  Iterator<WeightedState<S>> shortestDistanceAcyclicFrom(final S state)
      throws AutomatonException;

  Iterator<WeightedState<S>> shortestDistanceAcyclicFrom(final S state,
      final Direction direction) throws AutomatonException;

  /**
   * Forward shortest distance from weighted initial states.
   */
  Iterator<WeightedState<S>> shortestDistanceAcyclic(final Iterable<WeightedState<S>> initialStates)
      throws AutomatonException;

  /**
   * Shortest distance from the given weighted initial states to every state reachable from them,
   * in topological order. Only the reachable part needs to be acyclic; a cycle there fails the call
   * before anything is returned.
   *
   * The initial states are read once, during the call. The result is computed as it is consumed.
   */
  Iterator<WeightedState<S>> shortestDistanceAcyclic(final Iterable<WeightedState<S>> initialStates,
      final Direction direction) throws AutomatonException;


  ///// Views /////
  /**
   * A read-only view of this automaton with every arc and terminal label passed through the given
   * function, eg. to project transducer labels onto their costs. {@link Identity#ZERO} and
   * {@link Identity#ONE} belong to every semiring and are passed through as they are.
   *
   * The view is lazy: labels are transformed whenever they are read, and states, arcs and labels
   * added to this automaton later show up in the view. Terminal labels that the function maps to
   * zero are not listed by {@link #terminalStates(Direction)}. Adding to the view throws
   * {@link UnsupportedOperationException}.
   */
  Automaton<S> transformLabels(final Function<Semiring, Semiring> function);


  ///// Housekeeping /////
  /**
   * Reports the id of this automaton.
   */
  String getId();

  /**
   * Returns the config that this automaton is sized with.
   */
  AutomatonConfiguration getConfiguration();

  /**
   * Report statistics for this automaton.
   */
  AutomatonStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build automata.
   */
  public final static class AutomatonBuilder<S> {
    private AutomatonConfiguration config;
    private final List<S> states = new ArrayList<>();

    public static <S> AutomatonBuilder<S> newBuilder() {
      return new AutomatonBuilder<S>();
    }

    public AutomatonBuilder<S> config(final AutomatonConfiguration config) {
      this.config = config;
      return this;
    }

    public AutomatonBuilder<S> state(final S state) {
      this.states.add(state);
      return this;
    }

    public AutomatonBuilder<S> states(final Iterable<S> states) {
      for (S state : states) {
        this.states.add(state);
      }
      return this;
    }

    public Automaton<S> build() throws AutomatonException {
      final AutomatonImpl<S> automaton = new AutomatonImpl<>(config);
      for (final S state : states) {
        automaton.addState(state);
      }
      return automaton;
    }

    private AutomatonBuilder() {}
  }

}
