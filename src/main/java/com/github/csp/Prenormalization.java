package com.github.csp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prenormalizes a process. Cursors already keep track of the set of states a process might be in,
 * so the only thing left to do is compute the τ-closure of each such set: every state reachable
 * through τ's alone is folded into the current one.
 * 
 * The wrapped process has the same maximal finite traces as the original, as long as τ is hidden.
 */
public final class Prenormalization<E> implements Process<E> {
  private final HiddenEvents<E> hidden;
  private final Process<E> process;

  Prenormalization(final HiddenEvents<E> hidden, final Process<E> process) {
    this.hidden = hidden;
    this.process = process;
  }

  public Process<E> getProcess() {
    return process;
  }

  @Override
  public Cursor<E> root() {
    final PrenormalizationCursor<E> cursor =
        new PrenormalizationCursor<>(hidden, new LinkedHashSet<Cursor<E>>());
    final List<Cursor<E>> roots = new ArrayList<>(1);
    roots.add(process.root());
    cursor.tauClose(roots);
    return cursor;
  }

  @Override
  public int hashCode() {
    return process.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Prenormalization)) {
      return false;
    }
    return process.equals(((Prenormalization<?>) obj).process);
  }

  @Override
  public String toString() {
    return "prenormalize " + process;
  }

  static final class PrenormalizationCursor<E> implements Cursor<E> {
    private final HiddenEvents<E> hidden;
    // members are never mutated while they sit in the set
    private final Set<Cursor<E>> tauClosed;

    private PrenormalizationCursor(final HiddenEvents<E> hidden, final Set<Cursor<E>> tauClosed) {
      this.hidden = hidden;
      this.tauClosed = tauClosed;
    }

    private void tauClose(final List<Cursor<E>> cursors) {
      final Deque<Cursor<E>> toAdd = new ArrayDeque<>(cursors);
      while (!toAdd.isEmpty()) {
        final Cursor<E> next = toAdd.removeFirst();
        // only expand states we haven't seen, otherwise τ-loops never end
        if (tauClosed.add(next) && next.canPerform(hidden.tau())) {
          toAdd.addLast(next.after(hidden.tau()));
        }
      }
    }

    @Override
    public Alphabet<E> initials() {
      final List<Alphabet<E>> alphabets = new ArrayList<>(tauClosed.size());
      for (final Cursor<E> subcursor : tauClosed) {
        alphabets.add(subcursor.initials());
      }
      return Alphabets.union(alphabets);
    }

    @Override
    public boolean canPerform(final E event) {
      for (final Cursor<E> subcursor : tauClosed) {
        if (subcursor.canPerform(event)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public void perform(final E event) {
      if (!canPerform(event)) {
        throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT,
            String.format("Prenormalized process cannot perform %s", event));
      }
      final List<Cursor<E>> afters = new ArrayList<>(tauClosed.size());
      for (final Cursor<E> subcursor : tauClosed) {
        if (subcursor.canPerform(event)) {
          afters.add(subcursor);
        }
      }
      tauClosed.clear();
      for (final Cursor<E> after : afters) {
        after.perform(event);
      }
      tauClose(afters);
    }

    @Override
    public PrenormalizationCursor<E> deepClone() {
      final Set<Cursor<E>> cloned = new LinkedHashSet<>();
      for (final Cursor<E> subcursor : tauClosed) {
        cloned.add(subcursor.deepClone());
      }
      return new PrenormalizationCursor<>(hidden, cloned);
    }

    @Override
    public int hashCode() {
      return tauClosed.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof PrenormalizationCursor)) {
        return false;
      }
      return tauClosed.equals(((PrenormalizationCursor<?>) obj).tauClosed);
    }

    @Override
    public String toString() {
      return "PrenormalizationCursor " + tauClosed;
    }
  }
}
