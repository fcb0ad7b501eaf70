package io.doublezero.globalmonitor.domain.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ProbeResultTest {

  @Test
  void statsDeriveLoss() {
    ProbeStats stats = ProbeStats.of(4, 3, Duration.ofMillis(1), Duration.ofMillis(2), Duration.ZERO);

    assertEquals(1, stats.packetsLost());
    assertEquals(0.25, stats.lossRatio(), 1e-9);
  }

  @Test
  void statsClampLossAndAvoidDivisionByZero() {
    ProbeStats none = ProbeStats.of(0, 0, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    ProbeStats extra = ProbeStats.of(2, 3, Duration.ZERO, Duration.ZERO, Duration.ZERO);

    assertEquals(0.0, none.lossRatio());
    assertEquals(0, extra.packetsLost());
  }

  @Test
  void timestampCopyKeepsOutcome() {
    RuntimeException cause = new RuntimeException("boom");
    ProbeResult failed = ProbeResult.failure(ProbeFailReason.TIMEOUT, cause);
    Instant now = Instant.parse("2026-03-01T12:00:00Z");

    ProbeResult stamped = failed.withTimestamp(now);

    assertNull(failed.timestamp());
    assertEquals(now, stamped.timestamp());
    assertEquals(ProbeFailReason.TIMEOUT, stamped.failReason());
    assertSame(cause, stamped.failure());
    assertTrue(stamped.statsIfPresent().isEmpty());
  }

  @Test
  void notReadyIsDistinguished() {
    assertTrue(ProbeResult.failure(ProbeFailReason.NOT_READY, null).notReady());
  }

  @Test
  void okAndReasonMustAgree() {
    assertThrows(IllegalArgumentException.class,
        () -> new ProbeResult(null, true, null, ProbeFailReason.TIMEOUT, null));
    assertThrows(IllegalArgumentException.class, () -> new ProbeResult(null, false, null, null, null));
  }

  @Test
  void targetIdRendersTuple() {
    assertEquals("icmp/eth0/192.0.2.1", ProbeTargetId.icmp("eth0", "192.0.2.1").toString());
    assertEquals(ProbeTargetId.tpuquic("doublezero0", "100.64.0.5:8009"),
        new ProbeTargetId(ProbeType.TPUQUIC, "doublezero0", "100.64.0.5:8009"));
  }
}
