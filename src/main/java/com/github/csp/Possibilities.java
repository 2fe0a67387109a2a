package com.github.csp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * A set of possible current states for a process, where each current state is defined by the
 * current states of some subprocesses.
 * 
 * The subcursors live in one flat pool, with a parallel activation bit each. A {@link Possibility}
 * only names pool indices, so copying or forking a possibility copies indices rather than cursors.
 * This is the subset construction from automata theory: the engine cannot tell which possibility is
 * the real one, so every read-only query aggregates across all of them.
 * 
 * Invariant: every index named by a possibility refers to an activated subcursor, and every
 * activated subcursor is named by at least one possibility.
 */
final class Possibilities<E> implements DeepCloneable<Possibilities<E>> {
  private final List<Cursor<E>> subcursors;
  private final BitSet activated;
  private List<Possibility> possibilities;

  Possibilities(final List<Cursor<E>> subcursors) {
    this.subcursors = new ArrayList<>(subcursors);
    this.activated = new BitSet(subcursors.size());
    this.activated.set(0, subcursors.size());
    final int[] all = new int[subcursors.size()];
    for (int idx = 0; idx < all.length; idx++) {
      all[idx] = idx;
    }
    this.possibilities = new ArrayList<>();
    this.possibilities.add(new Possibility(all));
  }

  private Possibilities(final List<Cursor<E>> subcursors, final BitSet activated,
      final List<Possibility> possibilities) {
    this.subcursors = subcursors;
    this.activated = activated;
    this.possibilities = possibilities;
  }

  /**
   * Returns the subcursors that are still activated, in pool order.
   */
  List<Cursor<E>> activatedSubcursors() {
    final List<Cursor<E>> result = new ArrayList<>(activated.cardinality());
    for (int idx = activated.nextSetBit(0); idx >= 0; idx = activated.nextSetBit(idx + 1)) {
      result.add(subcursors.get(idx));
    }
    return result;
  }

  /**
   * Returns the activated members of each possibility. Mostly useful for tests and debugging.
   */
  List<List<Cursor<E>>> possibilities() {
    final List<List<Cursor<E>>> result = new ArrayList<>(possibilities.size());
    for (final Possibility possibility : possibilities) {
      final List<Cursor<E>> members = new ArrayList<>(possibility.indices.length);
      for (final int idx : possibility.indices) {
        if (activated.get(idx)) {
          members.add(subcursors.get(idx));
        }
      }
      result.add(members);
    }
    return result;
  }

  /**
   * Returns all of the events that any subprocess can perform in any possible current state.
   */
  Alphabet<E> initials() {
    final List<Alphabet<E>> alphabets = new ArrayList<>();
    for (final Cursor<E> subcursor : activatedSubcursors()) {
      alphabets.add(subcursor.initials());
    }
    return Alphabets.union(alphabets);
  }

  /**
   * Returns whether any subprocess in any possible current state can perform {@code event}.
   */
  boolean canPerform(final E event) {
    for (int idx = activated.nextSetBit(0); idx >= 0; idx = activated.nextSetBit(idx + 1)) {
      if (subcursors.get(idx).canPerform(event)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Tries to have each activated subprocess perform {@code event}. Any subprocess that can't is
   * deactivated, and dropped from the possibilities it belonged to.
   */
  void performAll(final E event) {
    for (int idx = activated.nextSetBit(0); idx >= 0; idx = activated.nextSetBit(idx + 1)) {
      final Cursor<E> subcursor = subcursors.get(idx);
      if (subcursor.canPerform(event)) {
        subcursor.perform(event);
      } else {
        activated.clear(idx);
      }
    }
    final List<Possibility> next = new ArrayList<>(possibilities.size());
    for (final Possibility possibility : possibilities) {
      final Possibility retained = possibility.retain(activated);
      if (retained.indices.length > 0) {
        next.add(retained);
      }
    }
    possibilities = next;
  }

  /**
   * Tries to perform {@code event} in each possible current state, with exactly one subprocess of
   * that state moving at a time. Any possible current state that can't perform the event is
   * dropped.
   * 
   * If more than one subprocess of a possibility can perform the event, the possibility is
   * "splittable": an outside observer can't tell which of them moved, so it forks into one
   * possibility per eligible subprocess. The forks are not de-duplicated; two interleavings that
   * reach the same combination of states show up as two possibilities.
   */
  void performPiecewise(final E event) {
    final int subcursorCount = subcursors.size();
    final int possibilityCount = possibilities.size();

    // 1. still-activated subprocesses that can perform the event
    final BitSet eligible = new BitSet(subcursorCount);
    for (int idx = activated.nextSetBit(0); idx >= 0; idx = activated.nextSetBit(idx + 1)) {
      if (subcursors.get(idx).canPerform(event)) {
        eligible.set(idx);
      }
    }

    // 2. eligible subprocesses per possibility; more than one makes the possibility splittable, and
    // every eligible subprocess in it splittable too
    final int[] eligiblePerPossibility = new int[possibilityCount];
    final BitSet splittable = new BitSet(subcursorCount);
    for (int pidx = 0; pidx < possibilityCount; pidx++) {
      final int[] indices = possibilities.get(pidx).indices;
      for (final int idx : indices) {
        if (eligible.get(idx)) {
          eligiblePerPossibility[pidx]++;
        }
      }
      if (eligiblePerPossibility[pidx] > 1) {
        for (final int idx : indices) {
          if (eligible.get(idx)) {
            splittable.set(idx);
          }
        }
      }
    }

    // 3. splittable subprocesses keep their before state for the possibilities where they don't
    // move, so their after state goes into a new slot of the pool; the rest move in place
    final int[] eligibleAfters = new int[subcursorCount];
    for (int idx = eligible.nextSetBit(0); idx >= 0; idx = eligible.nextSetBit(idx + 1)) {
      if (splittable.get(idx)) {
        eligibleAfters[idx] = subcursors.size();
        subcursors.add(subcursors.get(idx).after(event));
        activated.set(eligibleAfters[idx]);
      } else {
        subcursors.get(idx).perform(event);
        eligibleAfters[idx] = idx;
      }
    }

    // 4. one new possibility per eligible member of each old possibility, with that member swapped
    // for its after state. For in-place movers the swap is a no-op, which is fine.
    final List<Possibility> next = new ArrayList<>();
    for (int pidx = 0; pidx < possibilityCount; pidx++) {
      if (eligiblePerPossibility[pidx] == 0) {
        continue;
      }
      final int[] indices = possibilities.get(pidx).indices;
      for (int position = 0; position < indices.length; position++) {
        if (eligible.get(indices[position])) {
          next.add(possibilities.get(pidx).replace(position, eligibleAfters[indices[position]]));
        }
      }
    }
    possibilities = next;

    // 5. a subprocess no surviving possibility names can't be part of the real state anymore
    final BitSet referenced = new BitSet(subcursors.size());
    for (final Possibility possibility : possibilities) {
      for (final int idx : possibility.indices) {
        referenced.set(idx);
      }
    }
    activated.and(referenced);
  }

  @Override
  public Possibilities<E> deepClone() {
    final List<Cursor<E>> clonedSubcursors = new ArrayList<>(subcursors.size());
    for (final Cursor<E> subcursor : subcursors) {
      clonedSubcursors.add(subcursor.deepClone());
    }
    return new Possibilities<>(clonedSubcursors, (BitSet) activated.clone(),
        new ArrayList<>(possibilities));
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + subcursors.hashCode();
    result = prime * result + activated.hashCode();
    result = prime * result + possibilities.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Possibilities)) {
      return false;
    }
    final Possibilities<?> other = (Possibilities<?>) obj;
    return activated.equals(other.activated) && possibilities.equals(other.possibilities)
        && subcursors.equals(other.subcursors);
  }

  @Override
  public String toString() {
    return activatedSubcursors().toString();
  }

  /**
   * One possible current state, given by the pool indices of its subcursors. Immutable.
   */
  static final class Possibility {
    private final int[] indices;

    Possibility(final int[] indices) {
      this.indices = indices;
    }

    /**
     * Returns a copy with the index at {@code position} replaced.
     */
    Possibility replace(final int position, final int index) {
      if (indices[position] == index) {
        return this;
      }
      final int[] replaced = indices.clone();
      replaced[position] = index;
      return new Possibility(replaced);
    }

    /**
     * Returns a copy holding only the indices set in {@code keep}.
     */
    Possibility retain(final BitSet keep) {
      int kept = 0;
      for (final int idx : indices) {
        if (keep.get(idx)) {
          kept++;
        }
      }
      if (kept == indices.length) {
        return this;
      }
      final int[] retained = new int[kept];
      int position = 0;
      for (final int idx : indices) {
        if (keep.get(idx)) {
          retained[position++] = idx;
        }
      }
      return new Possibility(retained);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(indices);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Possibility)) {
        return false;
      }
      return Arrays.equals(indices, ((Possibility) obj).indices);
    }

    @Override
    public String toString() {
      return Arrays.toString(indices);
    }
  }
}
