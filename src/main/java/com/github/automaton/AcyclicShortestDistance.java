package com.github.automaton;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

import com.github.automaton.AutomatonException.Code;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Lazy list of states and their shortest distances from a set of weighted initial states, for
 * automata that are acyclic where it matters: on the part reachable from the initial states.
 *
 * States come out in topological order. As each state is produced, the arcs from it are relaxed:
 * the distance of every state it leads to is combined (plus) with the state's own distance extended
 * by the arc label (times). Since all arcs into a state come from states earlier in the order, its
 * distance is final by the time it is produced. Distances are held only for states that have been
 * reached but not produced yet.
 *
 * Everything that can fail on the automaton (unknown initial states, cycles) is checked by
 * {@link #start}; iteration itself only fails if the semiring does.
 */
final class AcyclicShortestDistance<S> implements Iterator<WeightedState<S>> {
  private final StateRegistry<S> registry;
  private final ArcStore<S> arcs;
  private final Direction direction;
  // applied to every arc label as it is read
  private final Function<Semiring, Semiring> labels;
  private final IntArrayList order;
  private int position;

  // K=state index, V=distance so far
  private final Int2ObjectOpenHashMap<Semiring> distances;

  private AcyclicShortestDistance(final StateRegistry<S> registry, final ArcStore<S> arcs,
      final Direction direction, final Function<Semiring, Semiring> labels,
      final IntArrayList order, final Int2ObjectOpenHashMap<Semiring> distances) {
    this.registry = registry;
    this.arcs = arcs;
    this.direction = direction;
    this.labels = labels;
    this.order = order;
    this.distances = distances;
  }

  /**
   * Consume the initial states and compute the order. Initial states that occur more than once are
   * combined with plus.
   */
  static <S> AcyclicShortestDistance<S> start(final StateRegistry<S> registry,
      final ArcStore<S> arcs, final Iterable<WeightedState<S>> initialStates,
      final Direction direction, final Function<Semiring, Semiring> labels)
      throws AutomatonException {
    if (initialStates == null) {
      throw new AutomatonException(Code.INVALID_STATE, "Initial states cannot be null");
    }
    final Int2ObjectOpenHashMap<Semiring> distances = new Int2ObjectOpenHashMap<>();
    // visit roots in state insertion order, so the result does not depend on the order of the
    // initial states
    final boolean[] isRoot = new boolean[registry.size()];
    for (final WeightedState<S> initialState : initialStates) {
      final int index = registry.indexOf(initialState.getState());
      final Semiring label = initialState.getLabel();
      if (label == null) {
        throw new AutomatonException(Code.INVALID_LABEL,
            "Null initial label for state " + initialState.getState(), initialState.getState());
      }
      final Semiring previous = distances.get(index);
      distances.put(index, previous == null ? label : previous.plus(label));
      isRoot[index] = true;
    }
    final IntArrayList roots = new IntArrayList(distances.size());
    for (int index = 0; index < isRoot.length; index++) {
      if (isRoot[index]) {
        roots.add(index);
      }
    }
    final IntArrayList order =
        TopologicalSorter.sort(registry, arcs, direction, roots.toIntArray());
    return new AcyclicShortestDistance<>(registry, arcs, direction, labels, order, distances);
  }

  @Override
  public boolean hasNext() {
    return position < order.size();
  }

  @Override
  public WeightedState<S> next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more states");
    }
    final int state = order.getInt(position++);
    // every state in the order is an initial state or reached from an earlier one
    final Semiring distance = distances.remove(state);
    final List<Arc<S>> arcsOn = arcs.arcsOn(direction, state);
    final IntList neighbours = arcs.neighbours(direction, state);
    for (int i = 0; i < neighbours.size(); i++) {
      final int next = neighbours.getInt(i);
      final Semiring label = labels.apply(arcsOn.get(i).getLabel());
      final Semiring extended = direction.extend(distance, label);
      final Semiring previous = distances.get(next);
      distances.put(next, previous == null ? extended : previous.plus(extended));
    }
    return WeightedState.of(registry.stateAt(state), distance);
  }
}
