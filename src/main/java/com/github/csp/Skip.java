package com.github.csp;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;

/**
 * The process that performs ✔ and then becomes {@link Stop}. Used to mark the end of a process
 * that can be sequentially composed with something else.
 */
public final class Skip<E> extends Csp<E> {
  private final HiddenEvents<E> hidden;
  private final Stop<E> stop = new Stop<>();

  Skip(final HiddenEvents<E> hidden) {
    this.hidden = hidden;
  }

  @Override
  public Kind kind() {
    return Kind.SKIP;
  }

  @Override
  public Cursor<E> root() {
    return new SkipCursor<>(hidden, SkipState.BEFORE_TICK);
  }

  @Override
  public Set<E> initials() {
    return Collections.singleton(hidden.tick());
  }

  // Operational semantics for Skip
  //
  // 1) ────────────────
  //     Skip -✔→ Stop
  @Override
  public Collection<Csp<E>> afters(final E initial) {
    if (hidden.isTick(initial)) {
      return Collections.<Csp<E>>singleton(stop);
    }
    return Collections.emptySet();
  }

  @Override
  int computeHashCode() {
    return Skip.class.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Skip;
  }

  @Override
  public String toString() {
    return "Skip";
  }

  static enum SkipState {
    BEFORE_TICK, AFTER_TICK;
  }

  static final class SkipCursor<E> implements Cursor<E> {
    private final HiddenEvents<E> hidden;
    private SkipState state;

    private SkipCursor(final HiddenEvents<E> hidden, final SkipState state) {
      this.hidden = hidden;
      this.state = state;
    }

    @Override
    public Alphabet<E> initials() {
      if (state == SkipState.BEFORE_TICK) {
        return Alphabets.singleton(hidden.tick());
      }
      return Alphabets.empty();
    }

    @Override
    public boolean canPerform(final E event) {
      return state == SkipState.BEFORE_TICK && hidden.isTick(event);
    }

    @Override
    public void perform(final E event) {
      if (!canPerform(event)) {
        throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT,
            String.format("Skip cannot perform %s in state %s", event, state));
      }
      state = SkipState.AFTER_TICK;
    }

    @Override
    public SkipCursor<E> deepClone() {
      return new SkipCursor<>(hidden, state);
    }

    @Override
    public int hashCode() {
      return state.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof SkipCursor)) {
        return false;
      }
      return state == ((SkipCursor<?>) obj).state;
    }

    @Override
    public String toString() {
      return "SkipCursor [state=" + state + "]";
    }
  }
}
