package io.doublezero.globalmonitor.domain.probe;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of a single probe invocation.
 *
 * @param timestamp logical time of the tick that produced the result
 * @param ok whether the probe succeeded
 * @param stats statistics when available; may be {@code null}
 * @param failReason failure classification; {@code null} on success
 * @param failure underlying error; may be {@code null}
 */
public record ProbeResult(
    Instant timestamp, boolean ok, ProbeStats stats, ProbeFailReason failReason, Throwable failure) {

  public ProbeResult {
    if (ok && failReason != null) {
      throw new IllegalArgumentException("successful result cannot carry a fail reason");
    }
    if (!ok && failReason == null) {
      throw new IllegalArgumentException("failed result requires a fail reason");
    }
  }

  public static ProbeResult success(ProbeStats stats) {
    return new ProbeResult(null, true, Objects.requireNonNull(stats, "stats"), null, null);
  }

  public static ProbeResult failure(ProbeFailReason reason, Throwable cause) {
    return new ProbeResult(null, false, null, reason, cause);
  }

  public static ProbeResult failure(ProbeFailReason reason, ProbeStats stats, Throwable cause) {
    return new ProbeResult(null, false, stats, reason, cause);
  }

  /** Returns a copy stamped with the given tick time. */
  public ProbeResult withTimestamp(Instant tickTime) {
    return new ProbeResult(tickTime, ok, stats, failReason, failure);
  }

  public boolean notReady() {
    return failReason == ProbeFailReason.NOT_READY;
  }

  public Optional<ProbeStats> statsIfPresent() {
    return Optional.ofNullable(stats);
  }
}
