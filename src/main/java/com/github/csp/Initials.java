package com.github.csp;

import java.util.Set;

/**
 * Returns the events that a process is willing to perform, without going through a cursor.
 */
public interface Initials<E> {
  Set<E> initials();
}
