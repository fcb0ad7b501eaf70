package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.probe.PlanKind;
import io.doublezero.globalmonitor.domain.probe.ProbePath;
import io.doublezero.globalmonitor.domain.probe.ProbePlan;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Accumulates targets for one planner, keeping one instance and one plan per id.
 */
final class TargetCollector {
  private final Map<String, List<ProbeTarget>> byEntity = new LinkedHashMap<>();
  private final Map<ProbeTargetId, ProbeTarget> dedup = new LinkedHashMap<>();
  private final Map<ProbeTargetId, Set<String>> owners = new LinkedHashMap<>();

  /**
   * Attaches the target with {@code id} to {@code entityKey}, creating it only on first sight.
   */
  void add(String entityKey, ProbeTargetId id, Supplier<ProbeTarget> factory) {
    ProbeTarget target = dedup.computeIfAbsent(id, ignored -> factory.get());
    if (owners.computeIfAbsent(id, ignored -> new LinkedHashSet<>()).add(entityKey)) {
      byEntity.computeIfAbsent(entityKey, ignored -> new ArrayList<>()).add(target);
    }
  }

  PlanBatch toBatch(PlanKind kind, Source source) {
    List<ProbePlan> plans = new ArrayList<>(dedup.size());
    for (Map.Entry<ProbeTargetId, ProbeTarget> entry : dedup.entrySet()) {
      ProbeTargetId id = entry.getKey();
      ProbePath path = source.isOverlayIface(entry.getValue().iface())
          ? ProbePath.DOUBLEZERO
          : ProbePath.PUBLIC_INTERNET;
      plans.add(new ProbePlan(id, kind, path, List.copyOf(owners.get(id)), id.iface(), id.destination()));
    }
    return new PlanBatch(byEntity, plans, dedup);
  }
}
