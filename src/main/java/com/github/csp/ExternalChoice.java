package com.github.csp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The process {@code □ Ps}: offers the environment the initials of every process in {@code Ps}, and
 * behaves like whichever one performs the first visible event. An empty {@code Ps} behaves like
 * {@link Stop}.
 */
public final class ExternalChoice<E> extends Csp<E> {
  private final HiddenEvents<E> hidden;
  private final List<Csp<E>> processes;

  ExternalChoice(final HiddenEvents<E> hidden, final List<Csp<E>> processes) {
    this.hidden = hidden;
    this.processes = Collections.unmodifiableList(new ArrayList<>(processes));
  }

  public List<Csp<E>> getProcesses() {
    return processes;
  }

  @Override
  public Kind kind() {
    return Kind.EXTERNAL_CHOICE;
  }

  @Override
  public Cursor<E> root() {
    final List<Cursor<E>> subcursors = new ArrayList<>(processes.size());
    for (final Csp<E> process : processes) {
      subcursors.add(process.root());
    }
    return new ExternalChoiceCursor<>(hidden, ExternalChoiceState.UNRESOLVED,
        new Possibilities<>(subcursors));
  }

  @Override
  public Set<E> initials() {
    final Set<E> initials = new LinkedHashSet<>();
    for (final Csp<E> process : processes) {
      initials.addAll(process.initials());
    }
    return initials;
  }

  // Operational semantics for □ Ps
  //
  //                  P -τ→ P'
  // 1)  ────────────────────────────── P ∈ Ps
  //      □ Ps -τ→ □ (Ps ∖ {P} ∪ {P'})
  //
  //         P -a→ P'
  // 2)  ───────────── P ∈ Ps, a ≠ τ
  //      □ Ps -a→ P'
  @Override
  public Collection<Csp<E>> afters(final E initial) {
    final Set<Csp<E>> afters = new LinkedHashSet<>();
    if (hidden.isTau(initial)) {
      for (int idx = 0; idx < processes.size(); idx++) {
        for (final Csp<E> after : processes.get(idx).afters(initial)) {
          final List<Csp<E>> replaced = new ArrayList<>(processes);
          replaced.set(idx, after);
          afters.add(new ExternalChoice<>(hidden, replaced));
        }
      }
      return afters;
    }
    for (final Csp<E> process : processes) {
      afters.addAll(process.afters(initial));
    }
    return afters;
  }

  @Override
  int computeHashCode() {
    return 31 * Kind.EXTERNAL_CHOICE.hashCode() + processes.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ExternalChoice)) {
      return false;
    }
    final ExternalChoice<?> other = (ExternalChoice<?>) obj;
    return hashCode() == other.hashCode() && processes.equals(other.processes);
  }

  @Override
  public String toString() {
    if (processes.size() == 2) {
      return operand(processes.get(0)) + " □ " + operand(processes.get(1));
    }
    return "□ " + processes;
  }

  static enum ExternalChoiceState {
    UNRESOLVED, RESOLVED;
  }

  /**
   * While unresolved, each τ is performed by exactly one subprocess, so the possibilities fork
   * whenever several subprocesses could have taken it. The first visible event (✔ included)
   * resolves the choice: every plausible subprocess that can perform it does, all others drop out.
   */
  static final class ExternalChoiceCursor<E> implements Cursor<E> {
    private final HiddenEvents<E> hidden;
    private ExternalChoiceState state;
    private final Possibilities<E> possibilities;

    private ExternalChoiceCursor(final HiddenEvents<E> hidden, final ExternalChoiceState state,
        final Possibilities<E> possibilities) {
      this.hidden = hidden;
      this.state = state;
      this.possibilities = possibilities;
    }

    @Override
    public Alphabet<E> initials() {
      return possibilities.initials();
    }

    @Override
    public boolean canPerform(final E event) {
      return possibilities.canPerform(event);
    }

    @Override
    public void perform(final E event) {
      if (!canPerform(event)) {
        throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT,
            String.format("External choice cannot perform %s in state %s", event, state));
      }
      if (state == ExternalChoiceState.RESOLVED) {
        possibilities.performAll(event);
        return;
      }
      if (hidden.isTau(event)) {
        possibilities.performPiecewise(event);
        return;
      }
      possibilities.performAll(event);
      state = ExternalChoiceState.RESOLVED;
    }

    @Override
    public ExternalChoiceCursor<E> deepClone() {
      return new ExternalChoiceCursor<>(hidden, state, possibilities.deepClone());
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
      if (!(obj instanceof ExternalChoiceCursor)) {
        return false;
      }
      final ExternalChoiceCursor<?> other = (ExternalChoiceCursor<?>) obj;
      return state == other.state && Objects.equals(possibilities, other.possibilities);
    }

    @Override
    public String toString() {
      return "ExternalChoiceCursor [state=" + state + ", possibilities=" + possibilities + "]";
    }
  }
}
