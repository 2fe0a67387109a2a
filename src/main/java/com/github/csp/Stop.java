package com.github.csp;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;

/**
 * The process that performs no events at all (and prevents any other synchronized processes from
 * performing any, either).
 */
public final class Stop<E> extends Csp<E> {

  Stop() {}

  @Override
  public Kind kind() {
    return Kind.STOP;
  }

  @Override
  public Cursor<E> root() {
    return new StopCursor<>();
  }

  @Override
  public Set<E> initials() {
    return Collections.emptySet();
  }

  @Override
  public Collection<Csp<E>> afters(final E initial) {
    return Collections.emptySet();
  }

  @Override
  int computeHashCode() {
    return Stop.class.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Stop;
  }

  @Override
  public String toString() {
    return "Stop";
  }

  static final class StopCursor<E> implements Cursor<E> {

    @Override
    public Alphabet<E> initials() {
      return Alphabets.empty();
    }

    @Override
    public boolean canPerform(final E event) {
      return false;
    }

    @Override
    public void perform(final E event) {
      throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT,
          String.format("Stop cannot perform %s", event));
    }

    // stateless
    @Override
    public StopCursor<E> deepClone() {
      return this;
    }

    @Override
    public int hashCode() {
      return StopCursor.class.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof StopCursor;
    }

    @Override
    public String toString() {
      return "StopCursor";
    }
  }
}
