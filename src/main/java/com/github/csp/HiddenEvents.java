package com.github.csp;

import java.util.Objects;

/**
 * Supplies the two built-in hidden events of an event type. This is the only requirement the engine
 * places on events beyond value equality.
 * 
 * τ (tau) expresses nondeterminism and is never chosen by the environment. ✔ (tick) signals
 * successful termination and is what sequential composition hooks into.
 */
public interface HiddenEvents<E> {

  /**
   * The hidden event that expresses nondeterminism.
   */
  E tau();

  /**
   * The hidden event that signals successful termination.
   */
  E tick();

  default boolean isTau(final E event) {
    return Objects.equals(tau(), event);
  }

  default boolean isTick(final E event) {
    return Objects.equals(tick(), event);
  }
}
