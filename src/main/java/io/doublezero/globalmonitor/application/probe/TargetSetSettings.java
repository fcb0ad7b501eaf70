package io.doublezero.globalmonitor.application.probe;

import java.time.Duration;
import java.util.Objects;

/**
 * Execution settings for {@link TargetSet}.
 *
 * @param probeTimeout per-probe timeout derived from the tick context
 * @param maxConcurrency worker bound shared by prune and probe phases
 * @param verboseFailures log every failed probe at INFO
 * @param verboseSuccesses log every successful probe at INFO
 */
public record TargetSetSettings(
    Duration probeTimeout, int maxConcurrency, boolean verboseFailures, boolean verboseSuccesses) {
  public TargetSetSettings {
    Objects.requireNonNull(probeTimeout, "probeTimeout");
    if (probeTimeout.isZero() || probeTimeout.isNegative()) {
      throw new IllegalArgumentException("probeTimeout must be greater than 0");
    }
    if (maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be greater than 0");
    }
  }
}
