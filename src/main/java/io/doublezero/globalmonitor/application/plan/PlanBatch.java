package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.domain.probe.ProbePlan;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import java.util.List;
import java.util.Map;

/**
 * Planner output for one tick.
 *
 * @param targetsByEntity targets grouped by owning validator or user key
 * @param plans one plan per target id, listing every owning entity
 * @param dedup targets keyed by id, one instance per id
 */
public record PlanBatch(
    Map<String, List<ProbeTarget>> targetsByEntity,
    List<ProbePlan> plans,
    Map<ProbeTargetId, ProbeTarget> dedup) {}
