package com.github.csp;

/**
 * Simple statistics holder for a trace engine, accumulated across all of its enumerations.
 */
public final class TraceStatistics {
  private final String engineId;
  private final long startMillis = System.currentTimeMillis();
  int enumerations;
  long cursorsVisited;
  long cyclesDetected;
  long truncatedBranches;
  long tracesRecorded;

  TraceStatistics(final String engineId) {
    this.engineId = engineId;
  }

  public String getEngineId() {
    return engineId;
  }

  public int getEnumerations() {
    return enumerations;
  }

  public long getCursorsVisited() {
    return cursorsVisited;
  }

  public long getCyclesDetected() {
    return cyclesDetected;
  }

  public long getTruncatedBranches() {
    return truncatedBranches;
  }

  public long getTracesRecorded() {
    return tracesRecorded;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  @Override
  public String toString() {
    return "TraceStatistics [engineId=" + engineId + ", enumerations=" + enumerations
        + ", cursorsVisited=" + cursorsVisited + ", cyclesDetected=" + cyclesDetected
        + ", truncatedBranches=" + truncatedBranches + ", tracesRecorded=" + tracesRecorded + "]";
  }

}
