package com.github.csp;

/**
 * A CSP process is defined by what events it's willing and able to communicate, and when. Processes
 * are immutable; all state lives in the cursors they hand out.
 */
public interface Process<E> {

  /**
   * Returns a fresh cursor positioned at the initial state of this process.
   */
  Cursor<E> root();
}
