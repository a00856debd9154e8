package com.github.automaton;

/**
 * Simple statistics holder for an automaton. Counters are bumped by the automaton as it is built
 * and queried; they are not synchronized, in line with the automaton itself.
 */
public final class AutomatonStatistics {
  private final String automatonId;
  private final long startTstampMillis = System.currentTimeMillis();
  int states;
  int arcs;
  int topologicalSorts;
  int shortestDistanceQueries;
  int cyclesDetected;

  AutomatonStatistics(final String automatonId) {
    this.automatonId = automatonId;
  }

  public String getAutomatonId() {
    return automatonId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public int getStates() {
    return states;
  }

  public int getArcs() {
    return arcs;
  }

  public int getTopologicalSorts() {
    return topologicalSorts;
  }

  public int getShortestDistanceQueries() {
    return shortestDistanceQueries;
  }

  /**
   * Number of topological sorts and shortest distance queries that failed on a cycle.
   */
  public int getCyclesDetected() {
    return cyclesDetected;
  }

  @Override
  public String toString() {
    return "AutomatonStatistics [automatonId=" + automatonId + ", startTstampMillis="
        + startTstampMillis + ", states=" + states + ", arcs=" + arcs + ", topologicalSorts="
        + topologicalSorts + ", shortestDistanceQueries=" + shortestDistanceQueries
        + ", cyclesDetected=" + cyclesDetected + "]";
  }

}
