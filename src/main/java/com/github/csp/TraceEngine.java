package com.github.csp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Interprets the operational semantics of processes: what they can do next, and which finite
 * sequences of events they can perform.
 * 
 * Notes for users:<br>
 * 1. an engine instance is not thread-safe; it is cheap, so create one per thread if needed<br>
 * 
 * 2. enumeration explores every branch by cloning cursors, never by mutating the one it is handed,
 * so the caller's cursor is left untouched<br>
 * 
 * 3. the static helpers don't need an engine at all and neither log nor count anything<br>
 */
public final class TraceEngine<E> {
  private static final Logger logger = LogManager.getLogger(TraceEngine.class.getSimpleName());

  private final String engineId = UUID.randomUUID().toString();
  private final HiddenEvents<E> hidden;
  private final TraceConfiguration config;
  private final TraceStatistics engineStats;

  public TraceEngine(final HiddenEvents<E> hidden, final TraceConfiguration config) {
    if (hidden == null || config == null) {
      throw new ProcessException(ProcessException.Code.INVALID_CONFIGURATION,
          "Trace engine needs both hidden events and a configuration");
    }
    this.hidden = hidden;
    this.config = config;
    this.engineStats = new TraceStatistics(engineId);
    logDebug("Created trace engine with " + config);
  }

  public String getEngineId() {
    return engineId;
  }

  public TraceConfiguration getConfiguration() {
    return config;
  }

  public TraceStatistics getStatistics() {
    return engineStats;
  }

  /**
   * Returns the events that {@code cursor} is willing to perform now, with duplicates removed.
   */
  public static <E> Set<E> initials(final Cursor<E> cursor) {
    final Set<E> initials = new LinkedHashSet<>();
    for (final E event : cursor.events()) {
      initials.add(event);
    }
    return initials;
  }

  /**
   * For each initial event of {@code process}, collects the set of processes it might behave like
   * after performing that event.
   */
  public static <E, P extends Initials<E> & Afters<E, P>> Map<E, Set<P>> transitions(
      final P process) {
    final Map<E, Set<P>> transitions = new LinkedHashMap<>();
    for (final E initial : process.initials()) {
      final Set<P> afters = new LinkedHashSet<>(process.afters(initial));
      if (!afters.isEmpty()) {
        transitions.put(initial, Collections.unmodifiableSet(afters));
      }
    }
    return Collections.unmodifiableMap(transitions);
  }

  /**
   * Returns whether {@code cursor} can perform every event of {@code trace}, in order. The trace is
   * replayed on a clone, so {@code cursor} is left untouched.
   */
  public static <E> boolean satisfiesTrace(final Cursor<E> cursor, final Iterable<E> trace) {
    final Cursor<E> replay = cursor.deepClone();
    for (final E event : trace) {
      if (!replay.canPerform(event)) {
        return false;
      }
      replay.perform(event);
    }
    return true;
  }

  /**
   * Returns the maximal finite traces of the process whose current state is {@code cursor}.
   * 
   * A trace ends when the process has nothing left to perform, when a branch revisits a state it
   * has already passed through (a cycle), or when the branch reaches the configured depth bound.
   */
  public MaximalTraces<E> maximalFiniteTraces(final Cursor<E> cursor) {
    if (cursor == null) {
      throw new ProcessException(ProcessException.Code.NULL_PROCESS);
    }
    final long startNanos = System.nanoTime();
    final long cyclesBefore = engineStats.cyclesDetected;
    final long truncatedBefore = engineStats.truncatedBranches;
    engineStats.enumerations++;
    logDebug("Enumerating maximal finite traces from " + cursor);

    final MaximalTraces<E> result = new MaximalTraces<>();
    subprocess(result, cursor.deepClone(), new ArrayList<Cursor<E>>(), new ArrayList<E>(), 0);

    final long cycles = engineStats.cyclesDetected - cyclesBefore;
    final long truncated = engineStats.truncatedBranches - truncatedBefore;
    if (truncated > 0) {
      logWarning("Truncated " + truncated + " branches at maxDepth=" + config.getMaxDepth()
          + "; result is a lower bound");
    }
    logInfo("Enumerated " + result.size() + " maximal traces, cycles=" + cycles + ", truncated="
        + truncated + ", took " + (System.nanoTime() - startNanos) / 1000L + " micros");
    logDebug(engineStats.toString());
    return result;
  }

  private void subprocess(final MaximalTraces<E> result, final Cursor<E> cursor,
      final List<Cursor<E>> previousCursors, final List<E> currentTrace, final int depth) {
    engineStats.cursorsVisited++;

    // a state that already appears earlier on this branch closes a cycle
    if (previousCursors.contains(cursor)) {
      engineStats.cyclesDetected++;
      logDebug("Cycle detected after " + currentTrace);
      record(result, currentTrace);
      return;
    }

    final Set<E> initials = initials(cursor);
    if (initials.isEmpty()) {
      record(result, currentTrace);
      return;
    }

    if (config.isBounded() && depth >= config.getMaxDepth()) {
      engineStats.truncatedBranches++;
      record(result, currentTrace);
      return;
    }

    previousCursors.add(cursor);
    for (final E initial : initials) {
      final Cursor<E> next = cursor.after(initial);
      final boolean recorded = !(config.getHideTau() && hidden.isTau(initial));
      if (recorded) {
        currentTrace.add(initial);
      }
      subprocess(result, next, previousCursors, currentTrace, depth + 1);
      if (recorded) {
        currentTrace.remove(currentTrace.size() - 1);
      }
    }
    previousCursors.remove(previousCursors.size() - 1);
  }

  private void record(final MaximalTraces<E> result, final List<E> trace) {
    engineStats.tracesRecorded++;
    result.insert(trace);
  }

  private void logWarning(final String message) {
    logger.warn(new StringBuilder().append("[e:").append(engineId).append("] ").append(message)
        .toString());
  }

  private void logInfo(final String message) {
    logger.info(new StringBuilder().append("[e:").append(engineId).append("] ").append(message)
        .toString());
  }

  private void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[e:").append(engineId).append("] ")
          .append(message).toString());
    }
  }

}
