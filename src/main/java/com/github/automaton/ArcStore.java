package com.github.automaton;

import java.util.Collections;
import java.util.List;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Holds the arcs of an automaton, indexed by the dense state index on both ends. Every arc is
 * appended to the outgoing list of its source and to the incoming list of its target, so arcs on a
 * state come back in the order they were added.
 *
 * Next to each arc list runs a list with the index of the far end of each arc, which is what the
 * traversal algorithms walk. The two lists are always the same length.
 */
final class ArcStore<S> {
  private final int expectedArcsPerState;

  private final ObjectArrayList<ObjectArrayList<Arc<S>>> outgoing = new ObjectArrayList<>();
  private final ObjectArrayList<ObjectArrayList<Arc<S>>> incoming = new ObjectArrayList<>();
  private final ObjectArrayList<IntArrayList> targets = new ObjectArrayList<>();
  private final ObjectArrayList<IntArrayList> sources = new ObjectArrayList<>();

  ArcStore(final int expectedArcsPerState) {
    this.expectedArcsPerState = expectedArcsPerState;
  }

  /**
   * Make room for the state with the next index. Must be called once per state added to the
   * registry, in the same order.
   */
  void addState() {
    outgoing.add(new ObjectArrayList<Arc<S>>(expectedArcsPerState));
    incoming.add(new ObjectArrayList<Arc<S>>(expectedArcsPerState));
    targets.add(new IntArrayList(expectedArcsPerState));
    sources.add(new IntArrayList(expectedArcsPerState));
  }

  void addArc(final int sourceIndex, final int targetIndex, final Arc<S> arc) {
    outgoing.get(sourceIndex).add(arc);
    targets.get(sourceIndex).add(targetIndex);
    incoming.get(targetIndex).add(arc);
    sources.get(targetIndex).add(sourceIndex);
  }

  /**
   * Arcs leaving the state going forward, or arriving at it going backward, in add order.
   */
  List<Arc<S>> arcsOn(final Direction direction, final int index) {
    return Collections.unmodifiableList(
        direction == Direction.FORWARD ? outgoing.get(index) : incoming.get(index));
  }

  /**
   * For each arc in {@link #arcsOn(Direction, int)}, the index of the state it leads to.
   */
  IntList neighbours(final Direction direction, final int index) {
    return IntLists
        .unmodifiable(direction == Direction.FORWARD ? targets.get(index) : sources.get(index));
  }
}
