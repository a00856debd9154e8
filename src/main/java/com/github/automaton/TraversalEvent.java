package com.github.automaton;

/**
 * What happened to a state during a depth-first traversal of an automaton.
 */
public enum TraversalEvent {
  // the state starts a new depth-first tree; VISIT for the same state follows immediately
  NEW_ROOT,
  // the state is discovered; emitted exactly once per state reached
  VISIT,
  // all arcs out of the state are done; emitted exactly once per state reached, in reverse
  // topological order
  FINISH_VISIT,
  // an arc leads back to a state that is still being visited, so the automaton has a cycle
  BACK_STATE,
  // an arc leads to a state whose visit has already finished
  FORWARD_OR_CROSS_STATE;
}
