package com.github.csp;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Factory of the basic alphabets the operators compose their initials from.
 */
public final class Alphabets {

  @SuppressWarnings("unchecked")
  public static <E> Alphabet<E> empty() {
    return (Alphabet<E>) EmptyAlphabet.instance;
  }

  public static <E> Alphabet<E> singleton(final E event) {
    return new SetAlphabet<>(Collections.singleton(event));
  }

  public static <E> Alphabet<E> of(final Collection<E> events) {
    return new SetAlphabet<>(new LinkedHashSet<>(events));
  }

  /**
   * An alphabet containing every event of any of the given alphabets.
   */
  public static <E> Alphabet<E> union(final List<Alphabet<E>> alphabets) {
    if (alphabets.isEmpty()) {
      return empty();
    }
    if (alphabets.size() == 1) {
      return alphabets.get(0);
    }
    return new UnionAlphabet<>(new ArrayList<>(alphabets));
  }

  private Alphabets() {}

  private static final class EmptyAlphabet<E> implements Alphabet<E> {
    private static final EmptyAlphabet<Object> instance = new EmptyAlphabet<>();

    @Override
    public boolean contains(final E event) {
      return false;
    }

    @Override
    public Iterator<E> iterator() {
      return Collections.emptyIterator();
    }

    @Override
    public String toString() {
      return "{}";
    }
  }

  private static final class SetAlphabet<E> implements Alphabet<E> {
    private final Collection<E> events;

    private SetAlphabet(final Collection<E> events) {
      this.events = events;
    }

    @Override
    public boolean contains(final E event) {
      return events.contains(event);
    }

    @Override
    public Iterator<E> iterator() {
      return Collections.unmodifiableCollection(events).iterator();
    }

    @Override
    public String toString() {
      return events.toString();
    }
  }

  private static final class UnionAlphabet<E> implements Alphabet<E> {
    private final List<Alphabet<E>> alphabets;

    private UnionAlphabet(final List<Alphabet<E>> alphabets) {
      this.alphabets = alphabets;
    }

    @Override
    public boolean contains(final E event) {
      for (final Alphabet<E> alphabet : alphabets) {
        if (alphabet.contains(event)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public Iterator<E> iterator() {
      final List<E> events = new ArrayList<>();
      for (final Alphabet<E> alphabet : alphabets) {
        for (final E event : alphabet) {
          events.add(event);
        }
      }
      return events.iterator();
    }

    @Override
    public String toString() {
      return "UnionAlphabet " + Objects.toString(alphabets);
    }
  }
}
