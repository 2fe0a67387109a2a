package com.github.csp;

/**
 * Tracks the current state of a process, which defines which events it's willing to perform now.
 * After performing one of those events, the cursor moves into a different state.
 * 
 * Notes for implementors:<br>
 * 1. a cursor is a mutable snapshot; {@link #deepClone()} must return a cursor that shares no
 * mutable state with the original, since trace enumeration branches by cloning<br>
 * 
 * 2. cursors must implement value equality; the trace engine detects cycles by comparing the current
 * cursor against the cursors already visited on the current path<br>
 * 
 * 3. {@code initials().contains(e) == canPerform(e)} must hold for every event<br>
 */
public interface Cursor<E> extends DeepCloneable<Cursor<E>> {

  /**
   * Returns the set of events that the process is willing to perform in its current state, τ and ✔
   * included.
   */
  Alphabet<E> initials();

  /**
   * Same as {@link #initials()}; reads better when only iterating.
   */
  default Iterable<E> events() {
    return initials();
  }

  /**
   * Returns whether the process is willing to perform a particular event in its current state.
   */
  boolean canPerform(final E event);

  /**
   * Updates the current state of the cursor to describe what the process does after performing
   * {@code event}.
   * 
   * @throws ProcessException with {@link ProcessException.Code#ILLEGAL_EVENT} if the process is not
   *         willing to perform {@code event} in its current state
   */
  void perform(final E event);

  /**
   * Returns a clone of this cursor that has performed {@code event}, leaving this cursor untouched.
   */
  default Cursor<E> after(final E event) {
    final Cursor<E> after = deepClone();
    after.perform(event);
    return after;
  }
}
