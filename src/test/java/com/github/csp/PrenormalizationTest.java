package com.github.csp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Random;

import org.junit.Test;

public class PrenormalizationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private final CspAlgebra<Event> csp = CspAlgebra.standard();
  private final Event a = Event.named("a");
  private final Event b = Event.named("b");

  @Test
  public void testRootIsTauClosed() {
    final Csp<Event> choice =
        csp.internalChoice(csp.prefix(a, csp.stop()), csp.prefix(b, csp.stop()));
    final Cursor<Event> cursor = csp.prenormalize(choice).root();
    // the states before and after the τ are both part of the root
    assertEquals(new HashSet<>(Arrays.asList(Event.TAU, a, b)), TraceEngine.initials(cursor));
    cursor.perform(a);
    assertTrue(TraceEngine.initials(cursor).isEmpty());
    assertFalse(cursor.canPerform(b));
  }

  @Test(expected = ProcessException.class)
  public void testPerformUnavailableEvent() {
    csp.prenormalize(csp.prefix(a, csp.stop())).root().perform(b);
  }

  @Test
  public void testSameMaximalTraces() {
    final TraceEngine<Event> engine = csp.traceEngine();
    final RandomProcesses generator = new RandomProcesses(csp, new Random(17L));
    for (int iter = 0; iter < 100; iter++) {
      final Csp<Event> process = generator.next(3);
      assertEquals(process.toString(), engine.maximalFiniteTraces(process.root()),
          engine.maximalFiniteTraces(csp.prenormalize(process).root()));
    }
  }

  @Test
  public void testDeepCloneAndEquality() {
    final Prenormalization<Event> process = csp.prenormalize(csp.prefix(a, csp.stop()));
    final Cursor<Event> cursor = process.root();
    final Cursor<Event> clone = cursor.deepClone();
    assertEquals(cursor, clone);
    clone.perform(a);
    assertTrue(cursor.canPerform(a));
    assertFalse(cursor.equals(clone));

    assertEquals(process, csp.prenormalize(csp.prefix(a, csp.stop())));
    assertEquals(csp.prefix(a, csp.stop()), process.getProcess());
    assertEquals("prenormalize a → Stop", process.toString());
  }
}
