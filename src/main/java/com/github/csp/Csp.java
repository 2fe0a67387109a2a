package com.github.csp;

/**
 * A process type that includes all of the primitive processes and operators of the CSP language.
 * The set of subclasses is fixed: the constructor is package-private and every operator lives in
 * this package. Clients that need to match on the operator switch over {@link #kind()}.
 * 
 * Instances are immutable and share their children by reference, so the same subtree may safely
 * appear at several points of a larger process. You should never need to construct instances
 * directly; use a {@link CspAlgebra} instead.
 */
public abstract class Csp<E> implements Process<E>, Initials<E>, Afters<E, Csp<E>> {
  // immutable, so the structural hash is computed once
  private int hash;

  Csp() {}

  public abstract Kind kind();

  abstract int computeHashCode();

  @Override
  public final int hashCode() {
    int result = hash;
    if (result == 0) {
      result = computeHashCode();
      hash = result;
    }
    return result;
  }

  /**
   * Renders a child of an operator, wrapping the infix operators so that nesting stays readable.
   */
  static String operand(final Csp<?> process) {
    switch (process.kind()) {
      case INTERNAL_CHOICE:
      case EXTERNAL_CHOICE:
      case SEQUENTIAL_COMPOSITION:
        return "(" + process + ")";
      default:
        return process.toString();
    }
  }

  public static enum Kind {
    STOP, SKIP, PREFIX, INTERNAL_CHOICE, EXTERNAL_CHOICE, SEQUENTIAL_COMPOSITION;
  }
}
