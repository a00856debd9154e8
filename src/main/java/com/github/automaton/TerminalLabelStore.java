package com.github.automaton;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;

/**
 * Initial and final labels of states. Only non-zero labels are stored; a state without an entry has
 * label {@link Identity#ZERO}. Entries keep the position of the first time they were set, so
 * overwriting a label does not move the state to the back.
 */
final class TerminalLabelStore<S> {
  private final Object2ObjectLinkedOpenHashMap<S, Semiring> initialLabels =
      new Object2ObjectLinkedOpenHashMap<>();
  private final Object2ObjectLinkedOpenHashMap<S, Semiring> finalLabels =
      new Object2ObjectLinkedOpenHashMap<>();

  TerminalLabelStore() {
    initialLabels.defaultReturnValue(Identity.ZERO);
    finalLabels.defaultReturnValue(Identity.ZERO);
  }

  /**
   * The caller is responsible for checking that the state exists.
   */
  void setTerminalLabel(final Direction direction, final S state, final Semiring label) {
    final Object2ObjectLinkedOpenHashMap<S, Semiring> labels = labels(direction);
    if (label.isZero()) {
      labels.remove(state);
    } else {
      labels.put(state, label);
    }
  }

  Semiring getTerminalLabel(final Direction direction, final S state) {
    return labels(direction).get(state);
  }

  List<WeightedState<S>> terminalStates(final Direction direction) {
    final Object2ObjectLinkedOpenHashMap<S, Semiring> labels = labels(direction);
    final List<WeightedState<S>> terminalStates = new ArrayList<>(labels.size());
    for (final Object2ObjectMap.Entry<S, Semiring> entry : labels.object2ObjectEntrySet()) {
      terminalStates.add(WeightedState.of(entry.getKey(), entry.getValue()));
    }
    return terminalStates;
  }

  private Object2ObjectLinkedOpenHashMap<S, Semiring> labels(final Direction direction) {
    return direction == Direction.FORWARD ? initialLabels : finalLabels;
  }
}
