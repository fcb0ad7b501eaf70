package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.domain.probe.MeasurementPoint;
import io.doublezero.globalmonitor.domain.probe.PlanKind;
import io.doublezero.globalmonitor.domain.probe.ProbePlan;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a tick snapshot into probe plans for one scenario and renders results into points.
 *
 * <p>Planners are stateless across calls.</p>
 */
public interface ProbePlanner {
  PlanKind kind();

  PlanBatch buildPlans(TickInputs inputs);

  /**
   * Renders one point per owning entity of {@code plan}.
   */
  default List<MeasurementPoint> record(TickInputs inputs, ProbePlan plan, ProbeResult result) {
    List<MeasurementPoint> points = new ArrayList<>(plan.entityKeys().size());
    for (String entityKey : plan.entityKeys()) {
      recordEntity(inputs, plan, entityKey, result).ifPresent(points::add);
    }
    return points;
  }

  /**
   * Renders the measurement point for one entity of a plan.
   *
   * @return the point, or empty when nothing should be written (not ready, unknown interface,
   *     missing entity, success without stats)
   */
  Optional<MeasurementPoint> recordEntity(TickInputs inputs, ProbePlan plan, String entityKey, ProbeResult result);
}
