package com.github.automaton;

import com.github.automaton.AutomatonException.Code;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Computes topological orders from a depth-first traversal: the states in reverse order of
 * finishing their visit. The traversal runs to completion before anything is returned, so a cycle
 * always surfaces as an exception and never as a truncated order.
 */
final class TopologicalSorter {

  /**
   * Order all states of the automaton.
   */
  static <S> IntArrayList sort(final StateRegistry<S> registry, final ArcStore<S> arcs,
      final Direction direction) throws AutomatonException {
    return sort(registry,
        DepthFirstTraversal.overAllStates(arcs, direction, registry.size()));
  }

  /**
   * Order only the states reachable from the given roots. A cycle among unreachable states does not
   * matter.
   */
  static <S> IntArrayList sort(final StateRegistry<S> registry, final ArcStore<S> arcs,
      final Direction direction, final int[] roots) throws AutomatonException {
    return sort(registry, new DepthFirstTraversal(arcs, direction, registry.size(), roots));
  }

  private static <S> IntArrayList sort(final StateRegistry<S> registry,
      final DepthFirstTraversal traversal) throws AutomatonException {
    final IntArrayList finished = new IntArrayList(registry.size());
    while (traversal.hasNext()) {
      switch (traversal.advance()) {
        case FINISH_VISIT:
          finished.add(traversal.state());
          break;
        case BACK_STATE:
          final S state = registry.stateAt(traversal.state());
          throw new AutomatonException(Code.CYCLE_DETECTED,
              "Automaton not acyclic: state " + state + " has a path to itself", state);
        default:
          break;
      }
    }
    final IntArrayList order = new IntArrayList(finished.size());
    for (int i = finished.size() - 1; i >= 0; i--) {
      order.add(finished.getInt(i));
    }
    return order;
  }

  private TopologicalSorter() {}
}
