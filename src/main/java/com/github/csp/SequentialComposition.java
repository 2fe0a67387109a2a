package com.github.csp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * The process {@code P ; Q}: behaves like {@code P} until it performs ✔, then behaves like
 * {@code Q}. The ✔ that hands over from {@code P} to {@code Q} is hidden, so the outside world sees
 * it as a τ.
 */
public final class SequentialComposition<E> extends Csp<E> {
  private final HiddenEvents<E> hidden;
  private final Csp<E> p;
  private final Csp<E> q;

  SequentialComposition(final HiddenEvents<E> hidden, final Csp<E> p, final Csp<E> q) {
    this.hidden = hidden;
    this.p = p;
    this.q = q;
  }

  public Csp<E> getP() {
    return p;
  }

  public Csp<E> getQ() {
    return q;
  }

  @Override
  public Kind kind() {
    return Kind.SEQUENTIAL_COMPOSITION;
  }

  @Override
  public Cursor<E> root() {
    return new SequentialCompositionCursor<>(hidden, q.root(), p.root(),
        new ArrayList<Cursor<E>>());
  }

  @Override
  public Set<E> initials() {
    final Set<E> initials = new LinkedHashSet<>();
    for (final E initial : p.initials()) {
      initials.add(hidden.isTick(initial) ? hidden.tau() : initial);
    }
    return initials;
  }

  // Operational semantics for P ; Q
  //
  //        P -a→ P'
  // 1)  ─────────────────── a ≠ ✔
  //      P ; Q -a→ P' ; Q
  //
  //      P -✔→ P'
  // 2)  ─────────────
  //      P ; Q -τ→ Q
  @Override
  public Collection<Csp<E>> afters(final E initial) {
    final Set<Csp<E>> afters = new LinkedHashSet<>();
    if (hidden.isTick(initial)) {
      return afters;
    }
    for (final Csp<E> after : p.afters(initial)) {
      afters.add(new SequentialComposition<>(hidden, after, q));
    }
    if (hidden.isTau(initial) && !p.afters(hidden.tick()).isEmpty()) {
      afters.add(q);
    }
    return afters;
  }

  @Override
  int computeHashCode() {
    final int prime = 31;
    int result = Kind.SEQUENTIAL_COMPOSITION.hashCode();
    result = prime * result + p.hashCode();
    result = prime * result + q.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SequentialComposition)) {
      return false;
    }
    final SequentialComposition<?> other = (SequentialComposition<?>) obj;
    return hashCode() == other.hashCode() && p.equals(other.p) && q.equals(other.q);
  }

  @Override
  public String toString() {
    return operand(p) + " ; " + operand(q);
  }

  /**
   * Tracks the cursor of {@code P} for as long as it is plausible, plus one cursor of {@code Q} for
   * every τ that might have been {@code P}'s ✔. Every event is offered to all of them; the ones
   * that can't perform it drop out.
   */
  static final class SequentialCompositionCursor<E> implements Cursor<E> {
    private final HiddenEvents<E> hidden;
    private final Cursor<E> qRoot;
    private Cursor<E> p;
    private final List<Cursor<E>> qs;

    private SequentialCompositionCursor(final HiddenEvents<E> hidden, final Cursor<E> qRoot,
        final Cursor<E> p, final List<Cursor<E>> qs) {
      this.hidden = hidden;
      this.qRoot = qRoot;
      this.p = p;
      this.qs = qs;
    }

    @Override
    public Alphabet<E> initials() {
      final List<Alphabet<E>> alphabets = new ArrayList<>(qs.size() + 1);
      if (p != null) {
        alphabets.add(new TickHidingAlphabet<>(hidden, p.initials()));
      }
      for (final Cursor<E> q : qs) {
        alphabets.add(q.initials());
      }
      return Alphabets.union(alphabets);
    }

    @Override
    public boolean canPerform(final E event) {
      if (p != null && pCanPerform(event)) {
        return true;
      }
      for (final Cursor<E> q : qs) {
        if (q.canPerform(event)) {
          return true;
        }
      }
      return false;
    }

    private boolean pCanPerform(final E event) {
      if (hidden.isTick(event)) {
        return false;
      }
      if (hidden.isTau(event)) {
        return p.canPerform(event) || p.canPerform(hidden.tick());
      }
      return p.canPerform(event);
    }

    @Override
    public void perform(final E event) {
      if (!canPerform(event)) {
        throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT,
            String.format("Sequential composition cannot perform %s", event));
      }
      // Q cursors spawned by this event must not perform it too, so they go first
      qPerform(event);
      pPerform(event);
    }

    private void qPerform(final E event) {
      final Iterator<Cursor<E>> iterator = qs.iterator();
      while (iterator.hasNext()) {
        final Cursor<E> q = iterator.next();
        if (q.canPerform(event)) {
          q.perform(event);
        } else {
          iterator.remove();
        }
      }
    }

    private void pPerform(final E event) {
      if (p == null) {
        return;
      }
      if (hidden.isTau(event) && p.canPerform(hidden.tick())) {
        qs.add(qRoot.deepClone());
      }
      if (!hidden.isTick(event) && p.canPerform(event)) {
        p.perform(event);
      } else {
        p = null;
      }
    }

    @Override
    public SequentialCompositionCursor<E> deepClone() {
      final List<Cursor<E>> clonedQs = new ArrayList<>(qs.size());
      for (final Cursor<E> q : qs) {
        clonedQs.add(q.deepClone());
      }
      return new SequentialCompositionCursor<>(hidden, qRoot.deepClone(), DeepCloneable.clone(p),
          clonedQs);
    }

    @Override
    public int hashCode() {
      final int prime = 31;
      int result = 1;
      result = prime * result + qRoot.hashCode();
      result = prime * result + Objects.hashCode(p);
      result = prime * result + qs.hashCode();
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof SequentialCompositionCursor)) {
        return false;
      }
      final SequentialCompositionCursor<?> other = (SequentialCompositionCursor<?>) obj;
      return Objects.equals(p, other.p) && qs.equals(other.qs) && qRoot.equals(other.qRoot);
    }

    @Override
    public String toString() {
      return "SequentialCompositionCursor [p=" + p + ", qs=" + qs + "]";
    }
  }

  /**
   * The initials of {@code P} as seen from outside {@code P ; Q}: ✔ shows up as τ.
   */
  private static final class TickHidingAlphabet<E> implements Alphabet<E> {
    private final HiddenEvents<E> hidden;
    private final Alphabet<E> alphabet;

    private TickHidingAlphabet(final HiddenEvents<E> hidden, final Alphabet<E> alphabet) {
      this.hidden = hidden;
      this.alphabet = alphabet;
    }

    @Override
    public boolean contains(final E event) {
      if (hidden.isTick(event)) {
        return false;
      }
      if (hidden.isTau(event)) {
        return alphabet.contains(event) || alphabet.contains(hidden.tick());
      }
      return alphabet.contains(event);
    }

    @Override
    public Iterator<E> iterator() {
      final Iterator<E> events = alphabet.iterator();
      return new Iterator<E>() {
        @Override
        public boolean hasNext() {
          return events.hasNext();
        }

        @Override
        public E next() {
          if (!events.hasNext()) {
            throw new NoSuchElementException();
          }
          final E event = events.next();
          return hidden.isTick(event) ? hidden.tau() : event;
        }
      };
    }

    @Override
    public String toString() {
      return "TickHidingAlphabet " + alphabet;
    }
  }
}
