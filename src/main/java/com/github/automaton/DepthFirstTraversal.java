package com.github.automaton;

import java.util.NoSuchElementException;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Lazy depth-first traversal over the dense state indices of an automaton, reporting one
 * {@link TraversalEvent} per call to {@link #advance()}.
 *
 * Roots are tried in the order given; a root that has already been reached from an earlier root is
 * skipped. Arcs are followed in the order they were added. The recursion is kept on an explicit
 * stack, so arbitrarily long chains do not overflow the thread stack.
 *
 * The automaton must not change while a traversal is in progress.
 */
final class DepthFirstTraversal {
  private static final byte unvisited = 0;
  private static final byte visiting = 1;
  private static final byte visited = 2;

  private final ArcStore<?> arcs;
  private final Direction direction;
  private final int[] roots;
  private int nextRoot;

  private final byte[] visitStatus;

  // the recursion: states being visited and, for each, the position of the next arc to follow.
  // A position of -1 means the state has been pushed but its VISIT has not been reported yet.
  private final IntArrayList stackStates = new IntArrayList();
  private final IntArrayList stackPositions = new IntArrayList();

  // state of the last event reported
  private int state = -1;

  DepthFirstTraversal(final ArcStore<?> arcs, final Direction direction, final int stateCount,
      final int[] roots) {
    this.arcs = arcs;
    this.direction = direction;
    this.roots = roots;
    this.visitStatus = new byte[stateCount];
  }

  /**
   * Traversal over the whole automaton, with every state as a candidate root in index order.
   */
  static DepthFirstTraversal overAllStates(final ArcStore<?> arcs, final Direction direction,
      final int stateCount) {
    final int[] roots = new int[stateCount];
    for (int index = 0; index < stateCount; index++) {
      roots[index] = index;
    }
    return new DepthFirstTraversal(arcs, direction, stateCount, roots);
  }

  boolean hasNext() {
    if (!stackStates.isEmpty()) {
      return true;
    }
    while (nextRoot < roots.length && visitStatus[roots[nextRoot]] != unvisited) {
      nextRoot++;
    }
    return nextRoot < roots.length;
  }

  /**
   * Move on to the next event and return it; the state it concerns is then {@link #state()}.
   */
  TraversalEvent advance() {
    if (!hasNext()) {
      throw new NoSuchElementException("Traversal is exhausted");
    }
    if (stackStates.isEmpty()) {
      final int root = roots[nextRoot++];
      push(root);
      return report(root, TraversalEvent.NEW_ROOT);
    }
    while (true) {
      final int top = stackStates.size() - 1;
      final int current = stackStates.getInt(top);
      final int position = stackPositions.getInt(top);
      if (position == -1) {
        stackPositions.set(top, 0);
        visitStatus[current] = visiting;
        return report(current, TraversalEvent.VISIT);
      }
      final IntList neighbours = arcs.neighbours(direction, current);
      if (position == neighbours.size()) {
        visitStatus[current] = visited;
        stackStates.removeInt(top);
        stackPositions.removeInt(top);
        return report(current, TraversalEvent.FINISH_VISIT);
      }
      stackPositions.set(top, position + 1);
      final int next = neighbours.getInt(position);
      switch (visitStatus[next]) {
        case unvisited:
          push(next);
          break;
        case visiting:
          return report(next, TraversalEvent.BACK_STATE);
        default:
          return report(next, TraversalEvent.FORWARD_OR_CROSS_STATE);
      }
    }
  }

  int state() {
    return state;
  }

  private void push(final int index) {
    stackStates.add(index);
    stackPositions.add(-1);
  }

  private TraversalEvent report(final int state, final TraversalEvent event) {
    this.state = state;
    return event;
  }
}
