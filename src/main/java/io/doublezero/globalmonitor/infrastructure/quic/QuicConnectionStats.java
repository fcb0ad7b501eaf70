package io.doublezero.globalmonitor.infrastructure.quic;

import java.time.Duration;

/**
 * Connection-level counters sampled from a QUIC connection.
 */
public record QuicConnectionStats(
    Duration minRtt,
    Duration latestRtt,
    Duration smoothedRtt,
    Duration meanDeviation,
    long packetsSent,
    long packetsReceived) {

  public static final QuicConnectionStats EMPTY =
      new QuicConnectionStats(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, 0, 0);

  public QuicConnectionStats {
    minRtt = minRtt == null ? Duration.ZERO : minRtt;
    latestRtt = latestRtt == null ? Duration.ZERO : latestRtt;
    smoothedRtt = smoothedRtt == null ? Duration.ZERO : smoothedRtt;
    meanDeviation = meanDeviation == null ? Duration.ZERO : meanDeviation;
  }

  /**
   * True while the counters still hold their initial values: no deviation sample, no RTT sample,
   * or nothing sent.
   */
  public boolean looksUntouched() {
    return meanDeviation.isZero() || latestRtt.isZero() || packetsSent == 0;
  }
}
