package com.github.automaton;

import java.util.Collections;
import java.util.List;

import com.github.automaton.AutomatonException.Code;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Maps client states to dense internal indices, in insertion order. Index i belongs to the i-th
 * state added and is never reassigned; states cannot be removed.
 */
final class StateRegistry<S> {
  // K=state, V=dense index
  private final Object2IntOpenHashMap<S> indices;
  // index -> state; doubles as the insertion order
  private final ObjectArrayList<S> states;
  private final List<S> statesView;

  StateRegistry(final int expectedStates) {
    this.indices = new Object2IntOpenHashMap<>(expectedStates);
    this.indices.defaultReturnValue(-1);
    this.states = new ObjectArrayList<>(expectedStates);
    this.statesView = Collections.unmodifiableList(states);
  }

  boolean hasState(final S state) {
    return indices.containsKey(state);
  }

  /**
   * Returns the index assigned to the new state.
   */
  int addState(final S state) throws AutomatonException {
    if (state == null) {
      throw new AutomatonException(Code.INVALID_STATE);
    }
    if (indices.containsKey(state)) {
      throw new AutomatonException(Code.DUPLICATE_STATE, "State exists already: " + state, state);
    }
    final int index = states.size();
    indices.put(state, index);
    states.add(state);
    return index;
  }

  int indexOf(final S state) throws AutomatonException {
    final int index = indices.getInt(state);
    if (index == -1) {
      throw new AutomatonException(Code.UNKNOWN_STATE, "State not found: " + state, state);
    }
    return index;
  }

  S stateAt(final int index) {
    return states.get(index);
  }

  int size() {
    return states.size();
  }

  /**
   * Read-only view in insertion order. It reflects states added later.
   */
  List<S> states() {
    return statesView;
  }
}
