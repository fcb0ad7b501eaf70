package io.doublezero.globalmonitor.application.pipeline;

import io.doublezero.globalmonitor.domain.probe.PlanKind;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import io.doublezero.globalmonitor.domain.probe.ProbePath;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-tick aggregation of probe outcomes by (kind, path), logged once the tick completes.
 */
public final class ResultsSummary {
  private static final Logger log = LoggerFactory.getLogger(ResultsSummary.class);

  private final Map<Key, Bucket> buckets = new LinkedHashMap<>();

  public ResultsSummary() {
    for (ProbePath path : ProbePath.values()) {
      for (PlanKind kind : PlanKind.values()) {
        buckets.put(new Key(kind, path), new Bucket());
      }
    }
  }

  public void add(PlanKind kind, ProbePath path, ProbeResult result) {
    buckets.get(new Key(kind, path)).add(result);
  }

  public Bucket bucket(PlanKind kind, ProbePath path) {
    return buckets.get(new Key(kind, path));
  }

  /**
   * Logs one line per bucket. Overlay buckets are logged only when the overlay interface is
   * configured.
   */
  public void log(Duration tickDuration, boolean includeOverlay) {
    List<Key> keys = new ArrayList<>();
    for (PlanKind kind : PlanKind.values()) {
      keys.add(new Key(kind, ProbePath.PUBLIC_INTERNET));
    }
    if (includeOverlay) {
      for (PlanKind kind : PlanKind.values()) {
        keys.add(new Key(kind, ProbePath.DOUBLEZERO));
      }
    }
    for (Key key : keys) {
      Bucket b = buckets.get(key);
      log.info("Probe summary kind={} path={} total={} success={} failure={} notReady={} reasons={} "
              + "avgRttMs={} durationMs={}",
          key.kind(), key.path(), b.total(), b.success(), b.failure(), b.notReady(), b.reasons(),
          String.format(Locale.ROOT, "%.2f", b.averageRttMillis()), tickDuration.toMillis());
    }
  }

  /** Bucket identity. */
  public record Key(PlanKind kind, ProbePath path) {}

  /** Counters of one bucket. Not-ready results are counted apart from failures. */
  public static final class Bucket {
    private int success;
    private int failure;
    private int notReady;
    private long rttNanosTotal;
    private final Map<ProbeFailReason, Integer> reasons = new EnumMap<>(ProbeFailReason.class);

    void add(ProbeResult result) {
      if (result.ok()) {
        success++;
        if (result.stats() != null) {
          rttNanosTotal += result.stats().rttAvg().toNanos();
        }
      } else if (result.notReady()) {
        notReady++;
      } else {
        failure++;
        reasons.merge(result.failReason(), 1, Integer::sum);
      }
    }

    public int total() {
      return success + failure + notReady;
    }

    public int success() {
      return success;
    }

    public int failure() {
      return failure;
    }

    public int notReady() {
      return notReady;
    }

    public Map<ProbeFailReason, Integer> reasons() {
      return Collections.unmodifiableMap(new EnumMap<>(reasons));
    }

    public double averageRttMillis() {
      if (success == 0) {
        return 0d;
      }
      return rttNanosTotal / 1_000_000d / success;
    }
  }
}
