package io.doublezero.globalmonitor.domain.probe;

import java.time.Duration;
import java.util.Objects;

/**
 * Packet and RTT statistics captured by one probe invocation.
 *
 * @param packetsSent packets sent
 * @param packetsReceived packets received
 * @param packetsLost {@code max(sent - received, 0)}
 * @param lossRatio {@code lost / sent}, zero when nothing was sent
 * @param rttMin minimum round-trip time
 * @param rttAvg average (or smoothed) round-trip time
 * @param rttStdDev round-trip deviation
 */
public record ProbeStats(
    long packetsSent,
    long packetsReceived,
    long packetsLost,
    double lossRatio,
    Duration rttMin,
    Duration rttAvg,
    Duration rttStdDev) {

  public ProbeStats {
    Objects.requireNonNull(rttMin, "rttMin");
    Objects.requireNonNull(rttAvg, "rttAvg");
    Objects.requireNonNull(rttStdDev, "rttStdDev");
  }

  /**
   * Derives loss counters from raw send/receive counts.
   */
  public static ProbeStats of(
      long packetsSent, long packetsReceived, Duration rttMin, Duration rttAvg, Duration rttStdDev) {
    long lost = Math.max(packetsSent - packetsReceived, 0L);
    return new ProbeStats(
        packetsSent, packetsReceived, lost, safeDivide(lost, packetsSent), rttMin, rttAvg, rttStdDev);
  }

  /** Returns {@code numerator / denominator}, or zero when the denominator is zero. */
  public static double safeDivide(double numerator, double denominator) {
    if (denominator == 0d) {
      return 0d;
    }
    return numerator / denominator;
  }
}
