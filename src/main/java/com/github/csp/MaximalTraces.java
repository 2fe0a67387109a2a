package com.github.csp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * A set of traces that is maximal: no element of the set is a prefix of any other element.
 * Inserting a trace that is a prefix of one already present is a no-op, and inserting a trace
 * drops every present trace that is a prefix of it.
 */
public final class MaximalTraces<E> implements Iterable<List<E>> {
  private final Set<List<E>> traces = new LinkedHashSet<>();

  public MaximalTraces() {}

  @SafeVarargs
  public static <E> MaximalTraces<E> of(final List<E>... traces) {
    final MaximalTraces<E> result = new MaximalTraces<>();
    for (final List<E> trace : traces) {
      result.insert(trace);
    }
    return result;
  }

  /**
   * Returns the maximal traces of either argument, leaving both untouched.
   */
  public static <E> MaximalTraces<E> sum(final MaximalTraces<E> left,
      final MaximalTraces<E> right) {
    final MaximalTraces<E> result = new MaximalTraces<>();
    result.addAll(left);
    result.addAll(right);
    return result;
  }

  /**
   * Adds a trace, keeping the set maximal. Returns whether the set changed.
   */
  public boolean insert(final List<E> trace) {
    for (final List<E> existing : traces) {
      if (isPrefix(trace, existing)) {
        return false;
      }
    }
    final Iterator<List<E>> iterator = traces.iterator();
    while (iterator.hasNext()) {
      if (isPrefix(iterator.next(), trace)) {
        iterator.remove();
      }
    }
    traces.add(Collections.unmodifiableList(new ArrayList<>(trace)));
    return true;
  }

  public void addAll(final Iterable<List<E>> other) {
    for (final List<E> trace : other) {
      insert(trace);
    }
  }

  /**
   * Applies {@code mapper} to every event of every trace. Distinct events may map to the same one,
   * so the result is re-maximalized.
   */
  public <F> MaximalTraces<F> map(final Function<? super E, ? extends F> mapper) {
    final MaximalTraces<F> result = new MaximalTraces<>();
    for (final List<E> trace : traces) {
      final List<F> mapped = new ArrayList<>(trace.size());
      for (final E event : trace) {
        mapped.add(mapper.apply(event));
      }
      result.insert(mapped);
    }
    return result;
  }

  public boolean contains(final List<E> trace) {
    return traces.contains(trace);
  }

  public int size() {
    return traces.size();
  }

  public boolean isEmpty() {
    return traces.isEmpty();
  }

  public Set<List<E>> asSet() {
    return Collections.unmodifiableSet(traces);
  }

  @Override
  public Iterator<List<E>> iterator() {
    return asSet().iterator();
  }

  private static <E> boolean isPrefix(final List<E> prefix, final List<E> trace) {
    return prefix.size() <= trace.size() && prefix.equals(trace.subList(0, prefix.size()));
  }

  @Override
  public int hashCode() {
    return traces.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MaximalTraces)) {
      return false;
    }
    return traces.equals(((MaximalTraces<?>) obj).traces);
  }

  @Override
  public String toString() {
    return traces.toString();
  }
}
