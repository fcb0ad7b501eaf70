package io.doublezero.globalmonitor.application.pipeline;

import io.doublezero.globalmonitor.domain.probe.PlanKind;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import io.doublezero.globalmonitor.domain.probe.ProbePath;
import java.util.Map;

/**
 * Metric names and label helpers used by the runner and target registry.
 */
public final class MonitorMetrics {
  public static final String TICK_TOTAL = "gm.tick.total";
  public static final String TICK_DURATION_MS = "gm.tick.duration.ms";
  public static final String PLAN_PROBES_SUCCESS = "gm.plan.probes.success.total";
  public static final String PLAN_PROBES_NOT_READY = "gm.plan.probes.notready.total";
  public static final String PLAN_PROBES_FAIL = "gm.plan.probes.fail.total";
  public static final String TARGETS_CURRENT = "gm.targets.current";

  private MonitorMetrics() {
    // Utility
  }

  /** Labels identifying the scenario, path and protocol of a plan. */
  public static Map<String, String> planLabels(PlanKind kind, ProbePath path) {
    return Map.of(
        "kind", kind.label(),
        "path", path.label(),
        "probe_type", kind.probeType().label());
  }

  /** Plan labels plus the failure reason. */
  public static Map<String, String> failLabels(PlanKind kind, ProbePath path, ProbeFailReason reason) {
    return Map.of(
        "kind", kind.label(),
        "path", path.label(),
        "probe_type", kind.probeType().label(),
        "reason", reason.label());
  }

  public static Map<String, String> outcomeLabels(TickOutcome outcome) {
    return Map.of("outcome", outcome.label());
  }
}
