package com.github.csp;

/**
 * A ready-made event type. Applications are free to bring their own event type instead, as long as
 * they also supply its {@link HiddenEvents}.
 * 
 * Events are compared by value. The built-in {@link #TAU} and {@link #TICK} events should never be
 * named directly when building processes; they only come about through the operational semantics
 * of the operators.
 */
public final class Event {
  private static final char[] subscriptDigits =
      {'₀', '₁', '₂', '₃', '₄', '₅', '₆', '₇', '₈', '₉'};

  public static final Event TAU = new Event(Kind.TAU, "τ");
  public static final Event TICK = new Event(Kind.TICK, "✔");

  public static final HiddenEvents<Event> HIDDEN = new HiddenEvents<Event>() {
    @Override
    public Event tau() {
      return TAU;
    }

    @Override
    public Event tick() {
      return TICK;
    }
  };

  private final Kind kind;
  private final String name;

  private Event(final Kind kind, final String name) {
    this.kind = kind;
    this.name = name;
  }

  public static Event named(final String name) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Event name cannot be null or empty");
    }
    return new Event(Kind.VISIBLE, name.trim());
  }

  /**
   * An event identified by a number, displayed as E with subscript digits, eg. E₁₀.
   */
  public static Event numbered(final int number) {
    if (number < 0) {
      throw new IllegalArgumentException("Event number cannot be negative: " + number);
    }
    final StringBuilder builder = new StringBuilder("E");
    for (final char digit : Integer.toString(number).toCharArray()) {
      builder.append(subscriptDigits[digit - '0']);
    }
    return new Event(Kind.VISIBLE, builder.toString());
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public boolean isHidden() {
    return kind != Kind.VISIBLE;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + kind.hashCode();
    result = prime * result + name.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    final Event other = (Event) obj;
    return kind == other.kind && name.equals(other.name);
  }

  @Override
  public String toString() {
    return name;
  }

  public static enum Kind {
    TAU, TICK, VISIBLE;
  }
}
