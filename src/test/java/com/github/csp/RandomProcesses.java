package com.github.csp;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates small random processes over the events a, b and c. Seeded, so every test run sees the
 * same processes.
 */
final class RandomProcesses {
  static final Event[] events = {Event.named("a"), Event.named("b"), Event.named("c")};

  private final CspAlgebra<Event> csp;
  private final Random random;

  RandomProcesses(final CspAlgebra<Event> csp, final Random random) {
    this.csp = csp;
    this.random = random;
  }

  /**
   * Returns a process whose syntax tree is at most {@code depth} operators deep.
   */
  Csp<Event> next(final int depth) {
    if (depth <= 0) {
      switch (random.nextInt(3)) {
        case 0:
          return csp.stop();
        case 1:
          return csp.skip();
        default:
          return csp.prefix(nextEvent(), csp.stop());
      }
    }
    switch (random.nextInt(7)) {
      case 0:
        return csp.stop();
      case 1:
        return csp.skip();
      case 2:
        return csp.prefix(nextEvent(), next(depth - 1));
      case 3:
        return csp.internalChoice(next(depth - 1), next(depth - 1));
      case 4:
        return csp.externalChoice(next(depth - 1), next(depth - 1));
      case 5:
        return csp.sequentialComposition(next(depth - 1), next(depth - 1));
      default:
        final int count = random.nextInt(4);
        final List<Csp<Event>> processes = new ArrayList<>(count);
        for (int idx = 0; idx < count; idx++) {
          processes.add(next(depth - 1));
        }
        return csp.replicatedExternalChoice(processes);
    }
  }

  Event nextEvent() {
    return events[random.nextInt(events.length)];
  }
}
