package com.github.csp;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * The process {@code a → P}: performs event {@code a} and then behaves like {@code P}.
 */
public final class Prefix<E> extends Csp<E> {
  private final E initial;
  private final Csp<E> after;

  Prefix(final E initial, final Csp<E> after) {
    this.initial = initial;
    this.after = after;
  }

  public E getInitial() {
    return initial;
  }

  public Csp<E> getAfter() {
    return after;
  }

  @Override
  public Kind kind() {
    return Kind.PREFIX;
  }

  @Override
  public Cursor<E> root() {
    return new PrefixCursor<>(PrefixState.BEFORE_INITIAL, initial, after.root());
  }

  @Override
  public Set<E> initials() {
    return Collections.singleton(initial);
  }

  // Operational semantics for a → P
  //
  // 1) ─────────────
  //     a → P -a→ P
  @Override
  public Collection<Csp<E>> afters(final E event) {
    if (Objects.equals(initial, event)) {
      return Collections.singleton(after);
    }
    return Collections.emptySet();
  }

  @Override
  int computeHashCode() {
    return 31 * Objects.hashCode(initial) + after.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Prefix)) {
      return false;
    }
    final Prefix<?> other = (Prefix<?>) obj;
    return hashCode() == other.hashCode() && Objects.equals(initial, other.initial)
        && after.equals(other.after);
  }

  @Override
  public String toString() {
    return initial + " → " + operand(after);
  }

  static enum PrefixState {
    BEFORE_INITIAL, AFTER_INITIAL;
  }

  static final class PrefixCursor<E> implements Cursor<E> {
    private PrefixState state;
    private final E initial;
    private final Cursor<E> after;

    private PrefixCursor(final PrefixState state, final E initial, final Cursor<E> after) {
      this.state = state;
      this.initial = initial;
      this.after = after;
    }

    @Override
    public Alphabet<E> initials() {
      if (state == PrefixState.BEFORE_INITIAL) {
        return Alphabets.singleton(initial);
      }
      return after.initials();
    }

    @Override
    public boolean canPerform(final E event) {
      if (state == PrefixState.BEFORE_INITIAL) {
        return Objects.equals(initial, event);
      }
      return after.canPerform(event);
    }

    @Override
    public void perform(final E event) {
      if (state == PrefixState.AFTER_INITIAL) {
        after.perform(event);
        return;
      }
      if (!Objects.equals(initial, event)) {
        throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT,
            String.format("Prefix cannot perform %s", event));
      }
      state = PrefixState.AFTER_INITIAL;
    }

    @Override
    public PrefixCursor<E> deepClone() {
      return new PrefixCursor<>(state, initial, after.deepClone());
    }

    @Override
    public int hashCode() {
      final int prime = 31;
      int result = 1;
      result = prime * result + state.hashCode();
      result = prime * result + Objects.hashCode(initial);
      result = prime * result + after.hashCode();
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof PrefixCursor)) {
        return false;
      }
      final PrefixCursor<?> other = (PrefixCursor<?>) obj;
      return state == other.state && Objects.equals(initial, other.initial)
          && after.equals(other.after);
    }

    @Override
    public String toString() {
      return "PrefixCursor [state=" + state + ", initial=" + initial + ", after=" + after + "]";
    }
  }
}
