package com.github.csp;

/**
 * A set of events, typically the events a cursor is willing to perform right now.
 * 
 * For some event types it's not easy (or efficient) to enumerate every member, so the primary
 * operation is the {@link #contains(Object)} predicate. Iteration is still offered for the alphabets
 * this engine builds; it may report the same event more than once, and callers that need a true set
 * must de-duplicate.
 */
public interface Alphabet<E> extends Iterable<E> {

  /**
   * Returns whether this alphabet contains a particular event.
   */
  boolean contains(final E event);
}
