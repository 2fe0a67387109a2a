package com.github.csp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import com.github.csp.TraceConfiguration.TraceConfigurationBuilder;

/**
 * Tests for ⊓ Ps.
 */
public class InternalChoiceTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final CspAlgebra<Event> csp = CspAlgebra.standard();
  private final Event a = Event.named("a");
  private final Event b = Event.named("b");

  @Test
  public void testInitialsAndTransitions() {
    final Csp<Event> p = csp.prefix(a, csp.stop());
    final Csp<Event> q = csp.prefix(b, csp.stop());
    final Csp<Event> choice = csp.internalChoice(p, q);
    assertEquals(Csp.Kind.INTERNAL_CHOICE, choice.kind());
    assertEquals(Collections.singleton(Event.TAU), choice.initials());
    assertEquals(Collections.singleton(Event.TAU), TraceEngine.initials(choice.root()));

    final Map<Event, Set<Csp<Event>>> expected = new HashMap<>();
    expected.put(Event.TAU, new HashSet<>(Arrays.asList(p, q)));
    assertEquals(expected, TraceEngine.transitions(choice));
  }

  @Test
  public void testCursorResolvesIrrevocably() {
    final Cursor<Event> cursor =
        csp.internalChoice(csp.prefix(a, csp.stop()), csp.prefix(b, csp.stop())).root();
    assertFalse(cursor.canPerform(a));
    cursor.perform(Event.TAU);
    assertFalse(cursor.canPerform(Event.TAU));
    assertEquals(new HashSet<>(Arrays.asList(a, b)), TraceEngine.initials(cursor));

    cursor.perform(a);
    // the branch that couldn't perform a is gone for good
    assertFalse(cursor.canPerform(b));
    assertTrue(TraceEngine.initials(cursor).isEmpty());
  }

  @Test(expected = ProcessException.class)
  public void testVisibleEventBeforeTau() {
    csp.internalChoice(csp.prefix(a, csp.stop()), csp.stop()).root().perform(a);
  }

  @Test
  public void testMaximalTraces() {
    final Csp<Event> choice =
        csp.internalChoice(csp.prefix(a, csp.stop()), csp.prefix(b, csp.stop()));
    assertEquals(MaximalTraces.of(Arrays.asList(a), Arrays.asList(b)),
        csp.traceEngine().maximalFiniteTraces(choice.root()));

    final TraceEngine<Event> tauEngine =
        csp.traceEngine(TraceConfigurationBuilder.newBuilder().hideTau(false).build());
    assertEquals(MaximalTraces.of(Arrays.asList(Event.TAU, a), Arrays.asList(Event.TAU, b)),
        tauEngine.maximalFiniteTraces(choice.root()));
  }

  @Test
  public void testMaximalTracesAreSum() {
    final TraceEngine<Event> engine = csp.traceEngine();
    final RandomProcesses generator = new RandomProcesses(csp, new Random(7L));
    for (int iter = 0; iter < 100; iter++) {
      final Csp<Event> p = generator.next(2);
      final Csp<Event> q = generator.next(2);
      final MaximalTraces<Event> expected = MaximalTraces.sum(
          engine.maximalFiniteTraces(p.root()), engine.maximalFiniteTraces(q.root()));
      assertEquals(p + " ⊓ " + q, expected,
          engine.maximalFiniteTraces(csp.internalChoice(p, q).root()));
    }
  }

  @Test
  public void testEmptyChoice() {
    try {
      csp.replicatedInternalChoice(Collections.<Csp<Event>>emptyList());
      fail("Built an internal choice over no processes");
    } catch (ProcessException expected) {
      assertEquals(ProcessException.Code.EMPTY_INTERNAL_CHOICE, expected.getCode());
    }
  }

  @Test(expected = ProcessException.class)
  public void testNullProcess() {
    csp.internalChoice(csp.stop(), null);
  }

  @Test
  public void testReplicated() {
    final Csp<Event> choice = csp.replicatedInternalChoice(
        Arrays.asList(csp.prefix(a, csp.stop()), csp.skip(), csp.stop()));
    assertEquals("⊓ [a → Stop, Skip, Stop]", choice.toString());
    assertEquals(3, TraceEngine.transitions(choice).get(Event.TAU).size());
    assertEquals(MaximalTraces.of(Arrays.asList(a), Arrays.asList(Event.TICK)),
        csp.traceEngine().maximalFiniteTraces(choice.root()));
  }

  @Test
  public void testEquality() {
    final Csp<Event> p = csp.prefix(a, csp.stop());
    assertEquals(csp.internalChoice(p, csp.skip()), csp.internalChoice(p, csp.skip()));
    assertFalse(csp.internalChoice(p, csp.skip()).equals(csp.internalChoice(csp.skip(), p)));
    assertFalse(csp.internalChoice(p, csp.skip()).equals(csp.externalChoice(p, csp.skip())));
    assertEquals("a → Stop ⊓ Skip", csp.internalChoice(p, csp.skip()).toString());
  }
}
