package io.doublezero.globalmonitor.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Tick loop settings.
 *
 * @param probeInterval time between tick starts
 * @param overlayConfigured whether an overlay interface is configured; controls overlay summaries
 */
public record RunnerSettings(Duration probeInterval, boolean overlayConfigured) {
  public RunnerSettings {
    Objects.requireNonNull(probeInterval, "probeInterval");
    if (probeInterval.isZero() || probeInterval.isNegative()) {
      throw new IllegalArgumentException("probeInterval must be greater than 0");
    }
  }
}
