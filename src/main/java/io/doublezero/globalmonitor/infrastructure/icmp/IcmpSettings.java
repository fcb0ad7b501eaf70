package io.doublezero.globalmonitor.infrastructure.icmp;

import java.time.Duration;

/**
 * Echo burst shape.
 *
 * @param count echoes per probe
 * @param interval spacing between echoes
 * @param size payload size in bytes
 */
public record IcmpSettings(int count, Duration interval, int size) {
  public static final int DEFAULT_COUNT = 3;
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);
  public static final int DEFAULT_SIZE = 56;

  public IcmpSettings {
    if (count <= 0) {
      count = DEFAULT_COUNT;
    }
    if (interval == null || interval.isZero() || interval.isNegative()) {
      interval = DEFAULT_INTERVAL;
    }
    if (size <= 0) {
      size = DEFAULT_SIZE;
    }
  }

  public static IcmpSettings defaults() {
    return new IcmpSettings(DEFAULT_COUNT, DEFAULT_INTERVAL, DEFAULT_SIZE);
  }
}
