package com.github.csp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The process {@code ⊓ Ps}: performs τ and then behaves like one of the processes in {@code Ps},
 * without the environment having any say in which one. The choice resolves irrevocably and
 * invisibly.
 */
public final class InternalChoice<E> extends Csp<E> {
  private final HiddenEvents<E> hidden;
  private final List<Csp<E>> processes;

  InternalChoice(final HiddenEvents<E> hidden, final List<Csp<E>> processes) {
    this.hidden = hidden;
    this.processes = Collections.unmodifiableList(new ArrayList<>(processes));
  }

  public List<Csp<E>> getProcesses() {
    return processes;
  }

  @Override
  public Kind kind() {
    return Kind.INTERNAL_CHOICE;
  }

  @Override
  public Cursor<E> root() {
    final List<Cursor<E>> subcursors = new ArrayList<>(processes.size());
    for (final Csp<E> process : processes) {
      subcursors.add(process.root());
    }
    return new InternalChoiceCursor<>(hidden, InternalChoiceState.BEFORE_TAU,
        new Possibilities<>(subcursors));
  }

  @Override
  public Set<E> initials() {
    return Collections.singleton(hidden.tau());
  }

  // Operational semantics for ⊓ Ps
  //
  // 1) ──────────── P ∈ Ps
  //     ⊓ Ps -τ→ P
  @Override
  public Collection<Csp<E>> afters(final E initial) {
    if (hidden.isTau(initial)) {
      return new LinkedHashSet<>(processes);
    }
    return Collections.emptySet();
  }

  @Override
  int computeHashCode() {
    return 31 * Kind.INTERNAL_CHOICE.hashCode() + processes.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof InternalChoice)) {
      return false;
    }
    final InternalChoice<?> other = (InternalChoice<?>) obj;
    return hashCode() == other.hashCode() && processes.equals(other.processes);
  }

  @Override
  public String toString() {
    if (processes.size() == 2) {
      return operand(processes.get(0)) + " ⊓ " + operand(processes.get(1));
    }
    return "⊓ " + processes;
  }

  static enum InternalChoiceState {
    BEFORE_TAU, AFTER_TAU;
  }

  static final class InternalChoiceCursor<E> implements Cursor<E> {
    private final HiddenEvents<E> hidden;
    private InternalChoiceState state;
    private final Possibilities<E> possibilities;

    private InternalChoiceCursor(final HiddenEvents<E> hidden, final InternalChoiceState state,
        final Possibilities<E> possibilities) {
      this.hidden = hidden;
      this.state = state;
      this.possibilities = possibilities;
    }

    @Override
    public Alphabet<E> initials() {
      if (state == InternalChoiceState.BEFORE_TAU) {
        return Alphabets.singleton(hidden.tau());
      }
      return possibilities.initials();
    }

    @Override
    public boolean canPerform(final E event) {
      if (state == InternalChoiceState.BEFORE_TAU) {
        return hidden.isTau(event);
      }
      return possibilities.canPerform(event);
    }

    @Override
    public void perform(final E event) {
      if (!canPerform(event)) {
        throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT,
            String.format("Internal choice cannot perform %s in state %s", event, state));
      }
      if (state == InternalChoiceState.BEFORE_TAU) {
        // every branch stays plausible until a later event rules it out
        state = InternalChoiceState.AFTER_TAU;
        return;
      }
      possibilities.performAll(event);
    }

    @Override
    public InternalChoiceCursor<E> deepClone() {
      return new InternalChoiceCursor<>(hidden, state, possibilities.deepClone());
    }

    @Override
    public int hashCode() {
      return 31 * state.hashCode() + possibilities.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof InternalChoiceCursor)) {
        return false;
      }
      final InternalChoiceCursor<?> other = (InternalChoiceCursor<?>) obj;
      return state == other.state && Objects.equals(possibilities, other.possibilities);
    }

    @Override
    public String toString() {
      return "InternalChoiceCursor [state=" + state + ", possibilities=" + possibilities + "]";
    }
  }
}
