package io.doublezero.globalmonitor.application.port;

import java.time.Instant;

/**
 * Time source used to stamp probe results, injectable for deterministic tests.
 */
@FunctionalInterface
public interface ClockPort {
  Instant now();

  /** Clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
