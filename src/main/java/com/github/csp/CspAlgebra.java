package com.github.csp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Builds CSP processes over one event type. Every operator is a method here, bound to the
 * {@link HiddenEvents} of that event type, so callers never deal with τ and ✔ themselves.
 * 
 * <pre>
 * final CspAlgebra&lt;Event&gt; csp = CspAlgebra.standard();
 * final Csp&lt;Event&gt; p = csp.prefix(Event.named("a"), csp.skip());
 * final MaximalTraces&lt;Event&gt; traces = csp.traceEngine().maximalFiniteTraces(p.root());
 * </pre>
 */
public final class CspAlgebra<E> {
  private static final CspAlgebra<Event> standard = new CspAlgebra<>(Event.HIDDEN);

  private final HiddenEvents<E> hidden;
  private final Stop<E> stop;
  private final Skip<E> skip;

  public CspAlgebra(final HiddenEvents<E> hidden) {
    if (hidden == null) {
      throw new ProcessException(ProcessException.Code.INVALID_CONFIGURATION,
          "Hidden events cannot be null");
    }
    this.hidden = hidden;
    this.stop = new Stop<>();
    this.skip = new Skip<>(hidden);
  }

  /**
   * The algebra over the ready-made {@link Event} type.
   */
  public static CspAlgebra<Event> standard() {
    return standard;
  }

  public HiddenEvents<E> getHiddenEvents() {
    return hidden;
  }

  public E tau() {
    return hidden.tau();
  }

  public E tick() {
    return hidden.tick();
  }

  public Csp<E> stop() {
    return stop;
  }

  public Csp<E> skip() {
    return skip;
  }

  public Csp<E> prefix(final E initial, final Csp<E> after) {
    return new Prefix<>(initial, checkProcess(after));
  }

  public Csp<E> internalChoice(final Csp<E> p, final Csp<E> q) {
    return replicatedInternalChoice(Arrays.asList(p, q));
  }

  /**
   * @throws ProcessException with {@link ProcessException.Code#EMPTY_INTERNAL_CHOICE} if
   *         {@code ps} is empty, since internal choice over nothing is undefined
   */
  public Csp<E> replicatedInternalChoice(final Collection<? extends Csp<E>> ps) {
    final List<Csp<E>> processes = checkProcesses(ps);
    if (processes.isEmpty()) {
      throw new ProcessException(ProcessException.Code.EMPTY_INTERNAL_CHOICE);
    }
    return new InternalChoice<>(hidden, processes);
  }

  public Csp<E> externalChoice(final Csp<E> p, final Csp<E> q) {
    return replicatedExternalChoice(Arrays.asList(p, q));
  }

  /**
   * An empty {@code ps} is allowed, and behaves like {@link #stop()}.
   */
  public Csp<E> replicatedExternalChoice(final Collection<? extends Csp<E>> ps) {
    return new ExternalChoice<>(hidden, checkProcesses(ps));
  }

  public Csp<E> sequentialComposition(final Csp<E> p, final Csp<E> q) {
    return new SequentialComposition<>(hidden, checkProcess(p), checkProcess(q));
  }

  public Prenormalization<E> prenormalize(final Process<E> process) {
    if (process == null) {
      throw new ProcessException(ProcessException.Code.NULL_PROCESS);
    }
    return new Prenormalization<>(hidden, process);
  }

  public TraceEngine<E> traceEngine() {
    return traceEngine(TraceConfiguration.defaults());
  }

  public TraceEngine<E> traceEngine(final TraceConfiguration config) {
    return new TraceEngine<>(hidden, config);
  }

  private static <E> Csp<E> checkProcess(final Csp<E> process) {
    if (process == null) {
      throw new ProcessException(ProcessException.Code.NULL_PROCESS);
    }
    return process;
  }

  private static <E> List<Csp<E>> checkProcesses(final Collection<? extends Csp<E>> ps) {
    if (ps == null) {
      throw new ProcessException(ProcessException.Code.NULL_PROCESS,
          "Collection of processes cannot be null");
    }
    final List<Csp<E>> processes = new ArrayList<>(ps.size());
    for (final Csp<E> process : ps) {
      processes.add(checkProcess(process));
    }
    return processes;
  }
}
