package com.github.csp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

/**
 * Tests the possible-worlds bookkeeping shared by the choice operators, using a cursor that can
 * perform a single event exactly once.
 */
public class PossibilitiesTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final String event = "e";

  @Test
  public void testEmpty() {
    final Possibilities<String> possibilities = possibilities();
    verifyCannotPerformEvent(possibilities);
    assertEquals(Collections.singletonList(Collections.<Cursor<String>>emptyList()),
        possibilities.possibilities());
  }

  @Test
  public void testPerformAllOneBefore() {
    final Possibilities<String> possibilities = possibilities(TestState.BEFORE_1);
    verifyCanPerformEvent(possibilities);
    possibilities.performAll(event);
    assertEquals(worlds(world(TestState.AFTER_1)), worldSet(possibilities));
    // After performing the event, we shouldn't be able to perform it anymore.
    verifyCannotPerformEvent(possibilities);
  }

  @Test
  public void testPerformAllOneAfter() {
    verifyCannotPerformEvent(possibilities(TestState.AFTER_1));
  }

  @Test
  public void testPerformAllTwoBefores() {
    final Possibilities<String> possibilities =
        possibilities(TestState.BEFORE_1, TestState.BEFORE_2);
    verifyCanPerformEvent(possibilities);
    possibilities.performAll(event);
    assertEquals(worlds(world(TestState.AFTER_1, TestState.AFTER_2)), worldSet(possibilities));
    verifyCannotPerformEvent(possibilities);
  }

  @Test
  public void testPerformAllOneOfEach() {
    final Possibilities<String> possibilities =
        possibilities(TestState.AFTER_1, TestState.BEFORE_2);
    verifyCanPerformEvent(possibilities);
    possibilities.performAll(event);
    // the subprocess that couldn't perform the event drops out
    assertEquals(worlds(world(TestState.AFTER_2)), worldSet(possibilities));
    assertEquals(1, possibilities.activatedSubcursors().size());
    verifyCannotPerformEvent(possibilities);
  }

  @Test
  public void testPerformPiecewiseOneBefore() {
    final Possibilities<String> possibilities = possibilities(TestState.BEFORE_1);
    possibilities.performPiecewise(event);
    assertEquals(worlds(world(TestState.AFTER_1)), worldSet(possibilities));
    verifyCannotPerformEvent(possibilities);
  }

  @Test
  public void testPerformPiecewiseTwoBefores() {
    final Possibilities<String> possibilities =
        possibilities(TestState.BEFORE_1, TestState.BEFORE_2);
    possibilities.performPiecewise(event);
    assertEquals(worlds(world(TestState.AFTER_1, TestState.BEFORE_2),
        world(TestState.BEFORE_1, TestState.AFTER_2)), worldSet(possibilities));

    // One of the subprocesses went first; now the other one can go.
    verifyCanPerformEvent(possibilities);
    possibilities.performPiecewise(event);
    // one copy per ordering of the subprocesses, they are not merged
    assertEquals(Arrays.asList(world(TestState.AFTER_1, TestState.AFTER_2),
        world(TestState.AFTER_1, TestState.AFTER_2)), possibilities.possibilities());

    verifyCannotPerformEvent(possibilities);
  }

  @Test
  public void testPerformPiecewiseOneOfEach() {
    final Possibilities<String> possibilities =
        possibilities(TestState.AFTER_1, TestState.BEFORE_2);
    possibilities.performPiecewise(event);
    // the subprocess that didn't move stays in its world
    assertEquals(worlds(world(TestState.AFTER_1, TestState.AFTER_2)), worldSet(possibilities));
    verifyCannotPerformEvent(possibilities);
  }

  @Test
  public void testPerformPiecewiseDropsWorldsThatCannotMove() {
    final Possibilities<String> possibilities =
        possibilities(TestState.BEFORE_1, TestState.BEFORE_2);
    possibilities.performPiecewise(event);
    assertEquals(4, possibilities.activatedSubcursors().size());
    possibilities.performAll(event);
    // only the before states could perform again, so only their worlds are left
    assertEquals(worlds(world(TestState.AFTER_2), world(TestState.AFTER_1)),
        worldSet(possibilities));
    assertEquals(2, possibilities.activatedSubcursors().size());
  }

  @Test
  public void testDeepCloneIsIndependent() {
    final Possibilities<String> possibilities =
        possibilities(TestState.BEFORE_1, TestState.BEFORE_2);
    final Possibilities<String> clone = possibilities.deepClone();
    assertEquals(possibilities, clone);
    clone.performPiecewise(event);
    assertEquals(worlds(world(TestState.BEFORE_1, TestState.BEFORE_2)),
        worldSet(possibilities));
    assertFalse(possibilities.equals(clone));
  }

  private static Possibilities<String> possibilities(final TestState... states) {
    final List<Cursor<String>> subcursors = new ArrayList<>();
    for (final TestState state : states) {
      subcursors.add(new TestCursor(state));
    }
    return new Possibilities<>(subcursors);
  }

  private static List<Cursor<String>> world(final TestState... states) {
    final List<Cursor<String>> world = new ArrayList<>();
    for (final TestState state : states) {
      world.add(new TestCursor(state));
    }
    return world;
  }

  @SafeVarargs
  private static Set<List<Cursor<String>>> worlds(final List<Cursor<String>>... worlds) {
    return new HashSet<>(Arrays.asList(worlds));
  }

  private static Set<List<Cursor<String>>> worldSet(final Possibilities<String> possibilities) {
    return new HashSet<>(possibilities.possibilities());
  }

  private static void verifyCanPerformEvent(final Possibilities<String> possibilities) {
    assertEquals(Collections.singleton(event), eventSet(possibilities.initials()));
    assertTrue(possibilities.canPerform(event));
  }

  private static void verifyCannotPerformEvent(final Possibilities<String> possibilities) {
    assertTrue(eventSet(possibilities.initials()).isEmpty());
    assertFalse(possibilities.canPerform(event));
  }

  private static Set<String> eventSet(final Alphabet<String> alphabet) {
    final Set<String> events = new HashSet<>();
    for (final String initial : alphabet) {
      events.add(initial);
    }
    return events;
  }

  static enum TestState {
    BEFORE_1, AFTER_1, BEFORE_2, AFTER_2;
  }

  static final class TestCursor implements Cursor<String> {
    private TestState state;

    TestCursor(final TestState state) {
      this.state = state;
    }

    private boolean before() {
      return state == TestState.BEFORE_1 || state == TestState.BEFORE_2;
    }

    @Override
    public Alphabet<String> initials() {
      return before() ? Alphabets.singleton(event) : Alphabets.<String>empty();
    }

    @Override
    public boolean canPerform(final String performed) {
      return before() && event.equals(performed);
    }

    @Override
    public void perform(final String performed) {
      if (!canPerform(performed)) {
        throw new ProcessException(ProcessException.Code.ILLEGAL_EVENT);
      }
      state = state == TestState.BEFORE_1 ? TestState.AFTER_1 : TestState.AFTER_2;
    }

    @Override
    public TestCursor deepClone() {
      return new TestCursor(state);
    }

    @Override
    public int hashCode() {
      return state.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof TestCursor && ((TestCursor) obj).state == state;
    }

    @Override
    public String toString() {
      return state.toString();
    }
  }
}
