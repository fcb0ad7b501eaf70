package io.doublezero.globalmonitor.infrastructure.icmp;

import java.time.Duration;

/**
 * Raw counters of one echo burst.
 */
public record IcmpStats(long sent, long received, Duration rttMin, Duration rttAvg, Duration rttStdDev) {
  public IcmpStats {
    rttMin = rttMin == null ? Duration.ZERO : rttMin;
    rttAvg = rttAvg == null ? Duration.ZERO : rttAvg;
    rttStdDev = rttStdDev == null ? Duration.ZERO : rttStdDev;
  }

  /** Counters that have not moved: nothing sent, or replies without an RTT. */
  public boolean looksUntouched() {
    return sent == 0 || (received > 0 && rttAvg.isZero());
  }
}
