package com.github.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonException.Code;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * A weighted finite-state automaton.
 *
 * Notes for users:<br>
 * 1. this automaton is not thread-safe and does no locking; see {@link Automaton}.<br>
 *
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * automata, just create as many as needed. Nothing is registered globally and no threads are
 * started, so an automaton is garbage collected like any other object.<br>
 *
 * 3. states are kept by dense index internally; the algorithms work on indices only and translate
 * back to states at the very end.<br>
 */
public final class AutomatonImpl<S> implements Automaton<S> {
  private static final Logger logger = LogManager.getLogger(AutomatonImpl.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final AutomatonConfiguration config;
  private final StateRegistry<S> registry;
  private final ArcStore<S> arcs;
  private final TerminalLabelStore<S> terminalLabels = new TerminalLabelStore<>();
  private final AutomatonStatistics automatonStats = new AutomatonStatistics(automatonId);

  public AutomatonImpl() {
    this(null);
  }

  public AutomatonImpl(final AutomatonConfiguration config) {
    this.config = config == null ? AutomatonConfiguration.defaults() : config;
    this.registry = new StateRegistry<>(this.config.getExpectedStates());
    this.arcs = new ArcStore<>(this.config.getExpectedArcsPerState());
    logInfo(automatonId, "Created automaton with " + this.config);
  }

  @Override
  public boolean hasState(final S state) {
    return registry.hasState(state);
  }

  @Override
  public void addState(final S state) throws AutomatonException {
    final int index = registry.addState(state);
    arcs.addState();
    automatonStats.states++;
    logDebug(automatonId, "Added state " + state + " at index " + index);
  }

  @Override
  public List<S> states() {
    return registry.states();
  }

  @Override
  public void addArc(final S source, final S target, final Semiring label)
      throws AutomatonException {
    // check everything before touching the store
    final int sourceIndex = registry.indexOf(source);
    final int targetIndex = registry.indexOf(target);
    if (label == null) {
      throw new AutomatonException(Code.INVALID_LABEL,
          "Null label on arc from " + source + " to " + target);
    }
    arcs.addArc(sourceIndex, targetIndex, new Arc<>(source, target, label));
    automatonStats.arcs++;
    logDebug(automatonId, "Added arc " + source + "->" + target + " labelled " + label);
  }

  @Override
  public List<Arc<S>> arcsOn(final Direction direction, final S state) throws AutomatonException {
    return arcs.arcsOn(direction, registry.indexOf(state));
  }

  @Override
  public void setTerminalLabel(final Direction direction, final S state, final Semiring label)
      throws AutomatonException {
    registry.indexOf(state);
    if (label == null) {
      throw new AutomatonException(Code.INVALID_LABEL,
          "Null " + terminalName(direction) + " label for state " + state, state);
    }
    terminalLabels.setTerminalLabel(direction, state, label);
    logDebug(automatonId, "Set " + terminalName(direction) + " label of " + state + " to " + label);
  }

  @Override
  public Semiring getTerminalLabel(final Direction direction, final S state)
      throws AutomatonException {
    registry.indexOf(state);
    return terminalLabels.getTerminalLabel(direction, state);
  }

  @Override
  public List<WeightedState<S>> terminalStates(final Direction direction) {
    return Collections.unmodifiableList(terminalLabels.terminalStates(direction));
  }

  @Override
  public Iterator<TraversedState<S>> traverse(final Direction direction) {
    final DepthFirstTraversal traversal =
        DepthFirstTraversal.overAllStates(arcs, direction, registry.size());
    return new Iterator<TraversedState<S>>() {
      @Override
      public boolean hasNext() {
        return traversal.hasNext();
      }

      @Override
      public TraversedState<S> next() {
        if (!traversal.hasNext()) {
          throw new NoSuchElementException("Traversal is exhausted");
        }
        final TraversalEvent event = traversal.advance();
        return new TraversedState<>(registry.stateAt(traversal.state()), event);
      }
    };
  }

  @Override
  public List<S> topologicalOrder() throws AutomatonException {
    return topologicalOrder(Direction.FORWARD);
  }

  @Override
  public List<S> topologicalOrder(final Direction direction) throws AutomatonException {
    automatonStats.topologicalSorts++;
    final IntArrayList order;
    try {
      order = TopologicalSorter.sort(registry, arcs, direction);
    } catch (AutomatonException cycle) {
      automatonStats.cyclesDetected++;
      logWarning(automatonId, "Topological sort " + direction + " failed: " + cycle.getMessage());
      throw cycle;
    }
    final List<S> states = new ArrayList<>(order.size());
    for (int i = 0; i < order.size(); i++) {
      states.add(registry.stateAt(order.getInt(i)));
    }
    logDebug(automatonId, "Topological order " + direction + ": " + states);
    return Collections.unmodifiableList(states);
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

  @Override
  public Iterator<WeightedState<S>> shortestDistanceAcyclic(
      final Iterable<WeightedState<S>> initialStates, final Direction direction)
      throws AutomatonException {
    return shortestDistanceAcyclic(initialStates, direction, Function.<Semiring>identity());
  }

  /**
   * Shortest distance with every arc label passed through the given function first.
   */
  Iterator<WeightedState<S>> shortestDistanceAcyclic(
      final Iterable<WeightedState<S>> initialStates, final Direction direction,
      final Function<Semiring, Semiring> labels) throws AutomatonException {
    automatonStats.shortestDistanceQueries++;
    try {
      final AcyclicShortestDistance<S> distances =
          AcyclicShortestDistance.start(registry, arcs, initialStates, direction, labels);
      logDebug(automatonId, "Started shortest distance " + direction);
      return distances;
    } catch (AutomatonException problem) {
      if (problem.getCode() == Code.CYCLE_DETECTED) {
        automatonStats.cyclesDetected++;
        logWarning(automatonId,
            "Shortest distance " + direction + " failed: " + problem.getMessage());
      }
      throw problem;
    }
  }

  @Override
  public Automaton<S> transformLabels(final Function<Semiring, Semiring> function) {
    if (function == null) {
      throw new IllegalArgumentException("Label function cannot be null");
    }
    logDebug(automatonId, "Created view with transformed labels");
    return new TransformedAutomaton<>(this, function);
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public AutomatonConfiguration getConfiguration() {
    return config;
  }

  @Override
  public AutomatonStatistics getStatistics() {
    return automatonStats;
  }

  private static String terminalName(final Direction direction) {
    return direction == Direction.FORWARD ? "initial" : "final";
  }

  private static void logWarning(final String automatonId, final String message) {
    logger.warn(new StringBuilder().append("[a:").append(automatonId).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String automatonId, final String message) {
    logger.info(new StringBuilder().append("[a:").append(automatonId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }

}
