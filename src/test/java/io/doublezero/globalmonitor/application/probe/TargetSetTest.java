package io.doublezero.globalmonitor.application.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.doublezero.globalmonitor.application.port.MetricsPort;
import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TargetSetTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private TargetSet targets;

  @AfterEach
  void tearDown() {
    if (targets != null) {
      targets.close();
    }
  }

  @Test
  void updateKeepsLiveInstancesAndClosesLeavers() {
    targets = newTargetSet(Duration.ofSeconds(1), 4);
    FakeProbeTarget a = target("192.0.2.1");
    FakeProbeTarget b = target("192.0.2.2");
    targets.update(map(a, b));

    FakeProbeTarget aAgain = target("192.0.2.1");
    FakeProbeTarget c = target("192.0.2.3");
    targets.update(map(aAgain, c));

    assertEquals(2, targets.size());
    assertSame(a, targets.get(a.id()));
    assertSame(c, targets.get(c.id()));
    assertEquals(0, a.closeCount());
    assertEquals(1, b.closeCount());
    assertEquals(0, aAgain.closeCount());
  }

  @Test
  void pruneWithNullClosesEverything() {
    targets = newTargetSet(Duration.ofSeconds(1), 2);
    FakeProbeTarget a = target("192.0.2.1");
    FakeProbeTarget b = target("192.0.2.2");
    FakeProbeTarget c = target("192.0.2.3");
    targets.update(map(a, b, c));

    targets.prune(null);

    assertEquals(0, targets.size());
    assertEquals(1, a.closeCount());
    assertEquals(1, b.closeCount());
    assertEquals(1, c.closeCount());
  }

  @Test
  void executeProbesStampsTickTime() throws Exception {
    targets = newTargetSet(Duration.ofSeconds(1), 4);
    FakeProbeTarget a = target("192.0.2.1");
    FakeProbeTarget b = target("192.0.2.2")
        .behave(ctx -> ProbeResult.failure(ProbeFailReason.PACKETS_LOST, null));
    targets.update(map(a, b));

    Map<ProbeTargetId, ProbeResult> results = targets.executeProbes(ProbeContext.background());

    assertEquals(2, results.size());
    assertTrue(results.get(a.id()).ok());
    assertEquals(NOW, results.get(a.id()).timestamp());
    assertEquals(ProbeFailReason.PACKETS_LOST, results.get(b.id()).failReason());
    assertEquals(NOW, results.get(b.id()).timestamp());
  }

  @Test
  void cancelledNullAndBrokenProbesAreOmitted() throws Exception {
    targets = newTargetSet(Duration.ofSeconds(1), 4);
    FakeProbeTarget cancelled = target("192.0.2.1").behave(ctx -> {
      throw new ProbeCancelledException("stop");
    });
    FakeProbeTarget empty = target("192.0.2.2").behave(ctx -> null);
    FakeProbeTarget broken = target("192.0.2.3").behave(ctx -> {
      throw new IllegalStateException("bug");
    });
    FakeProbeTarget fine = target("192.0.2.4");
    targets.update(map(cancelled, empty, broken, fine));

    Map<ProbeTargetId, ProbeResult> results = targets.executeProbes(ProbeContext.background());

    assertEquals(1, results.size());
    assertTrue(results.containsKey(fine.id()));
  }

  @Test
  void probeTimeoutBecomesTimeoutResult() throws Exception {
    targets = newTargetSet(Duration.ofSeconds(1), 4);
    FakeProbeTarget slow = target("192.0.2.1").behave(ctx -> {
      throw new TimeoutException("deadline");
    });
    targets.update(map(slow));

    ProbeResult result = targets.executeProbes(ProbeContext.background()).get(slow.id());

    assertFalse(result.ok());
    assertEquals(ProbeFailReason.TIMEOUT, result.failReason());
  }

  @Test
  void probeIgnoringItsDeadlineIsAbandoned() throws Exception {
    targets = newTargetSet(Duration.ofMillis(100), 4);
    FakeProbeTarget stuck = target("192.0.2.1").behave(ctx -> {
      try {
        Thread.sleep(30_000);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      return ProbeResult.success(FakeProbeTarget.OK_STATS);
    });
    targets.update(map(stuck));

    ProbeResult result = targets.executeProbes(ProbeContext.background()).get(stuck.id());

    assertEquals(ProbeFailReason.TIMEOUT, result.failReason());
    assertEquals(NOW, result.timestamp());
  }

  @Test
  void probesReceiveDeadlineDerivedFromTimeout() throws Exception {
    targets = newTargetSet(Duration.ofSeconds(3), 4);
    FakeProbeTarget a = target("192.0.2.1").behave(ctx -> {
      Duration left = ctx.remaining().orElseThrow();
      return left.compareTo(Duration.ofSeconds(3)) <= 0 && !left.isZero()
          ? ProbeResult.success(FakeProbeTarget.OK_STATS)
          : ProbeResult.failure(ProbeFailReason.OTHER, null);
    });
    targets.update(map(a));

    assertTrue(targets.executeProbes(ProbeContext.background()).get(a.id()).ok());
  }

  @Test
  void concurrencyStaysWithinLimit() throws Exception {
    targets = newTargetSet(Duration.ofSeconds(2), 2);
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    Map<ProbeTargetId, ProbeTarget> desired = new LinkedHashMap<>();
    for (int i = 1; i <= 6; i++) {
      FakeProbeTarget t = target("192.0.2." + i).behave(ctx -> {
        int now = inFlight.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        ctx.sleep(Duration.ofMillis(50));
        inFlight.decrementAndGet();
        return ProbeResult.success(FakeProbeTarget.OK_STATS);
      });
      desired.put(t.id(), t);
    }
    targets.update(desired);

    Map<ProbeTargetId, ProbeResult> results = targets.executeProbes(ProbeContext.background());

    assertEquals(6, results.size());
    assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
  }

  private static TargetSet newTargetSet(Duration timeout, int concurrency) {
    return new TargetSet(new TargetSetSettings(timeout, concurrency, true, true), () -> NOW, MetricsPort.NO_OP);
  }

  private static FakeProbeTarget target(String ip) {
    return new FakeProbeTarget(ProbeTargetId.icmp("eth0", ip));
  }

  private static Map<ProbeTargetId, ProbeTarget> map(FakeProbeTarget... items) {
    Map<ProbeTargetId, ProbeTarget> map = new LinkedHashMap<>();
    for (FakeProbeTarget item : items) {
      map.put(item.id(), item);
    }
    return map;
  }

  @Test
  void closesDuringPruneStayWithinLimit() {
    targets = newTargetSet(Duration.ofSeconds(2), 2);
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    List<FakeProbeTarget> stale = new ArrayList<>();
    Map<ProbeTargetId, ProbeTarget> desired = new LinkedHashMap<>();
    for (int i = 1; i <= 6; i++) {
      FakeProbeTarget t = target("192.0.2." + i).onClose(() -> {
        peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        pause(50);
        inFlight.decrementAndGet();
      });
      stale.add(t);
      desired.put(t.id(), t);
    }
    targets.update(desired);

    targets.prune(Map.of());

    assertEquals(0, targets.size());
    assertTrue(stale.stream().allMatch(t -> t.closeCount() == 1));
    assertTrue(peak.get() >= 1 && peak.get() <= 2, "peak concurrent closes was " + peak.get());
  }

  @Test
  void failingCloseStillWaitsForTheOthers() {
    targets = newTargetSet(Duration.ofSeconds(2), 2);
    AtomicInteger finished = new AtomicInteger();
    Map<ProbeTargetId, ProbeTarget> desired = new LinkedHashMap<>();
    for (int i = 1; i <= 6; i++) {
      boolean broken = i <= 2;
      FakeProbeTarget t = target("192.0.2." + i).onClose(() -> {
        if (broken) {
          throw new IllegalStateException("socket already gone");
        }
        pause(40);
        finished.incrementAndGet();
      });
      desired.put(t.id(), t);
    }
    targets.update(desired);

    targets.prune(null);

    assertEquals(4, finished.get());
    assertEquals(0, targets.size());
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
