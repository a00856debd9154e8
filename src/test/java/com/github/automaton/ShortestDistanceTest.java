package com.github.automaton;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.junit.Test;

import com.github.automaton.Automaton.AutomatonBuilder;
import com.github.automaton.AutomatonException.Code;

/**
 * Tests for the acyclic shortest distance over the cost and Viterbi semirings.
 */
public class ShortestDistanceTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Object two = AutomatonTest.state2;

  private static <S> List<WeightedState<S>> drain(final Iterator<WeightedState<S>> distances) {
    final List<WeightedState<S>> drained = new ArrayList<>();
    while (distances.hasNext()) {
      drained.add(distances.next());
    }
    return drained;
  }

  private static WeightedState<Object> cost(final Object state, final double value) {
    return WeightedState.<Object>of(state, new Cost(value));
  }

  @Test
  public void testFromSingleState() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    assertEquals(Arrays.asList(cost("start", 0.0), cost(1, 2.0), cost(two, 2.0), cost(3, 1.5)),
        drain(automaton.shortestDistanceAcyclicFrom("start")));
    assertEquals(1, automaton.getStatistics().getShortestDistanceQueries());
  }

  @Test
  public void testFromWeightedInitialState() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    assertEquals(Arrays.asList(cost("start", 1.0), cost(1, 3.0), cost(two, 3.0), cost(3, 2.5)),
        drain(automaton.shortestDistanceAcyclic(Arrays.asList(cost("start", 1.0)))));
  }

  @Test
  public void testFromMultipleInitialStates() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    final List<WeightedState<Object>> expected =
        Arrays.asList(cost("start", 0.5), cost(1, 2.5), cost(two, 1.0), cost(3, 1.5));
    assertEquals(expected, drain(automaton
        .shortestDistanceAcyclic(Arrays.asList(cost("start", 0.5), cost(two, 1.0)))));
    // the order of the initial states makes no difference
    assertEquals(expected, drain(automaton
        .shortestDistanceAcyclic(Arrays.asList(cost(two, 1.0), cost("start", 0.5)))));
  }

  @Test
  public void testRepeatedInitialStatesAreCombined() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    assertEquals(Arrays.asList(cost("start", 1.0), cost(1, 3.0), cost(two, 3.0), cost(3, 2.5)),
        drain(automaton.shortestDistanceAcyclic(
            Arrays.asList(cost("start", 3.0), cost("start", 1.0)))));
  }

  @Test
  public void testInitialStatesAreReadOnceUpFront() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    final int[] iterations = new int[1];
    final Iterable<WeightedState<Object>> initialStates = new Iterable<WeightedState<Object>>() {
      @Override
      public Iterator<WeightedState<Object>> iterator() {
        iterations[0]++;
        return Arrays.asList(cost("start", 0.5), cost(two, 1.0)).iterator();
      }
    };
    final Iterator<WeightedState<Object>> distances =
        automaton.shortestDistanceAcyclic(initialStates);
    assertEquals(1, iterations[0]);
    assertEquals(Arrays.asList(cost("start", 0.5), cost(1, 2.5), cost(two, 1.0), cost(3, 1.5)),
        drain(distances));
    assertEquals(1, iterations[0]);
  }

  @Test
  public void testPartialConsumptionAndExhaustion() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    final Iterator<WeightedState<Object>> distances =
        automaton.shortestDistanceAcyclicFrom("start");
    assertEquals(cost("start", 0.0), distances.next());
    assertEquals(cost(1, 2.0), distances.next());

    // a second query is independent of the first
    assertEquals(4, drain(automaton.shortestDistanceAcyclicFrom("start")).size());

    assertEquals(cost(two, 2.0), distances.next());
    assertEquals(cost(3, 1.5), distances.next());
    assertFalse(distances.hasNext());
    try {
      distances.next();
      fail("Expected NoSuchElementException");
    } catch (NoSuchElementException expected) {
    }
  }

  @Test
  public void testUnreachableStatesAreOmitted() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    assertEquals(Arrays.asList(cost(1, 0.0), cost(two, 0.0), cost(3, 0.5)),
        drain(automaton.shortestDistanceAcyclicFrom(1)));
    assertEquals(Arrays.asList(cost(3, 0.0)), drain(automaton.shortestDistanceAcyclicFrom(3)));
  }

  @Test
  public void testBackward() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    assertEquals(Arrays.asList(cost(3, 0.0), cost(two, 0.5), cost(1, 0.5), cost("start", 1.5)),
        drain(automaton.shortestDistanceAcyclicFrom(3, Direction.BACKWARD)));
    // from the final states, with their final labels
    assertEquals(Arrays.asList(cost(3, 2.0), cost(two, 2.5), cost(1, 2.5), cost("start", 3.5)),
        drain(automaton.shortestDistanceAcyclic(automaton.terminalStates(Direction.BACKWARD),
            Direction.BACKWARD)));
  }

  @Test
  public void testCycleOutsideReachablePartIsIgnored() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    automaton.addState("x");
    automaton.addState("y");
    automaton.addArc("x", "y", new Cost(1.0));
    automaton.addArc("y", "x", new Cost(1.0));
    automaton.addArc("y", "start", new Cost(1.0));

    assertEquals(Arrays.asList(cost("start", 0.0), cost(1, 2.0), cost(two, 2.0), cost(3, 1.5)),
        drain(automaton.shortestDistanceAcyclicFrom("start")));
    // the whole automaton has no topological order
    try {
      automaton.topologicalOrder();
      fail("Expected CYCLE_DETECTED");
    } catch (AutomatonException cycle) {
      assertEquals(Code.CYCLE_DETECTED, cycle.getCode());
    }
  }

  @Test
  public void testReachableCycleFailsUpFront() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    automaton.addArc(two, 1, new Cost(1.0));
    try {
      automaton.shortestDistanceAcyclicFrom("start");
      fail("Expected CYCLE_DETECTED");
    } catch (AutomatonException cycle) {
      assertEquals(Code.CYCLE_DETECTED, cycle.getCode());
    }
    assertEquals(1, automaton.getStatistics().getCyclesDetected());
    // 3 cannot reach the cycle
    assertEquals(Arrays.asList(cost(3, 0.0)), drain(automaton.shortestDistanceAcyclicFrom(3)));
  }

  @Test
  public void testUnknownInitialState() throws AutomatonException {
    final Automaton<Object> automaton = AutomatonTest.makeAutomaton();
    try {
      automaton.shortestDistanceAcyclic(Arrays.asList(cost("start", 0.0), cost(5, 0.0)));
      fail("Expected UNKNOWN_STATE");
    } catch (AutomatonException unknown) {
      assertEquals(Code.UNKNOWN_STATE, unknown.getCode());
      assertEquals(5, unknown.getState());
    }
    assertEquals(0, automaton.getStatistics().getCyclesDetected());
  }

  @Test
  public void testSameResultWhateverTheStateOrder() throws AutomatonException {
    // states added in reverse, arcs per state in the same order
    final Automaton<Object> automaton = AutomatonBuilder.<Object>newBuilder().state(3).state(two)
        .state(1).state("start").build();
    automaton.addArc("start", 3, new Cost(1.5));
    automaton.addArc("start", 1, new Cost(2.0));
    automaton.addArc(1, two, new Cost(0.0));
    automaton.addArc(two, 3, new Cost(0.5));

    final Automaton<Object> reference = AutomatonTest.makeAutomaton();
    assertEquals(reference.topologicalOrder(), automaton.topologicalOrder());
    assertEquals(drain(reference.shortestDistanceAcyclicFrom("start")),
        drain(automaton.shortestDistanceAcyclicFrom("start")));
  }

  private static Automaton<Integer> makeViterbiAutomaton() throws AutomatonException {
    final Automaton<Integer> automaton = AutomatonBuilder.<Integer>newBuilder()
        .states(Arrays.asList(1, 2, 3, 4, 5, 6)).build();

    automaton.addArc(1, 2, new Viterbi(5.0 / 8, Arrays.asList("a")));
    automaton.addArc(2, 3, new Viterbi(1.0 / 2, Arrays.asList("b")));
    automaton.addArc(3, 6, new Viterbi(1.0, Arrays.asList("c")));

    automaton.addArc(1, 4, new Viterbi(3.0 / 8, Arrays.asList("e")));
    automaton.addArc(4, 5, new Viterbi(1.0, Arrays.asList("f")));
    automaton.addArc(5, 6, new Viterbi(1.0, Arrays.asList("c")));

    automaton.addArc(2, 5, new Viterbi(1.0 / 8, Arrays.asList("b")));
    automaton.addArc(2, 5, new Viterbi(3.0 / 8, Arrays.asList("d")));

    automaton.setTerminalLabel(Direction.FORWARD, 1, Identity.ONE);
    automaton.setTerminalLabel(Direction.BACKWARD, 6, Identity.ONE);
    return automaton;
  }

  @Test
  public void testViterbiForwardAndBackwardAgree() throws AutomatonException {
    final Automaton<Integer> automaton = makeViterbiAutomaton();
    final Viterbi best = new Viterbi(3.0 / 8, Arrays.asList("e", "f", "c"));

    // 1. forward from the start state
    final List<WeightedState<Integer>> forward =
        drain(automaton.shortestDistanceAcyclicFrom(1));
    assertEquals(6, forward.size());
    final WeightedState<Integer> last = forward.get(forward.size() - 1);
    assertEquals(Integer.valueOf(6), last.getState());
    assertEquals(best, last.getLabel());

    // 2. backward from the final state
    final List<WeightedState<Integer>> backward =
        drain(automaton.shortestDistanceAcyclicFrom(6, Direction.BACKWARD));
    assertEquals(6, backward.size());
    final WeightedState<Integer> first = backward.get(backward.size() - 1);
    assertEquals(Integer.valueOf(1), first.getState());
    assertEquals(best, first.getLabel());
  }

  @Test
  public void testViterbiIntermediateDistances() throws AutomatonException {
    final Automaton<Integer> automaton = makeViterbiAutomaton();
    final List<WeightedState<Integer>> forward =
        drain(automaton.shortestDistanceAcyclic(automaton.terminalStates(Direction.FORWARD)));
    assertEquals(Arrays.asList(1, 4, 2, 5, 3, 6), statesOf(forward));
    // 1->2->5 via d at 15/64 loses against 1->4->5 at 24/64
    assertEquals(new Viterbi(3.0 / 8, Arrays.asList("e", "f")), forward.get(3).getLabel());
    assertEquals(new Viterbi(5.0 / 16, Arrays.asList("a", "b")), forward.get(4).getLabel());
    assertTrue(forward.get(0).getLabel().isOne());
  }

  private static <S> List<S> statesOf(final List<WeightedState<S>> weightedStates) {
    final List<S> states = new ArrayList<>(weightedStates.size());
    for (final WeightedState<S> weightedState : weightedStates) {
      states.add(weightedState.getState());
    }
    return states;
  }

}
