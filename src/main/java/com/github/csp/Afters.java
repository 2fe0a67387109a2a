package com.github.csp;

import java.util.Collection;

/**
 * Returns how a process behaves after one of its initial events is performed. The result is a
 * <em>set</em> of processes; if there are several, the process behaves like one of them, chosen
 * arbitrarily. The result is empty iff {@code initial} is not an initial event of the process.
 */
public interface Afters<E, P> {
  Collection<P> afters(final E initial);
}
