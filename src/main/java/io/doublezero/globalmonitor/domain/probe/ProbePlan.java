package io.doublezero.globalmonitor.domain.probe;

import java.util.List;
import java.util.Objects;

/**
 * One planned probe: which target, which scenario and path, and which entities the result belongs to.
 *
 * <p>Plans are rebuilt every tick. A planner emits at most one plan per target id; entities that
 * share a destination (validators behind one gossip address, say) are listed together and each gets
 * its own measurement point when the result is recorded.</p>
 *
 * @param id target id
 * @param kind scenario kind
 * @param path measurement path
 * @param entityKeys public keys of the owning validators or users, in planning order; never empty
 * @param iface interface the target probes from
 * @param destination target destination as rendered in the id
 */
public record ProbePlan(
    ProbeTargetId id, PlanKind kind, ProbePath path, List<String> entityKeys, String iface, String destination) {
  public ProbePlan {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(path, "path");
    entityKeys = List.copyOf(Objects.requireNonNull(entityKeys, "entityKeys"));
    if (entityKeys.isEmpty()) {
      throw new IllegalArgumentException("plan " + id + " has no owning entity");
    }
    Objects.requireNonNull(iface, "iface");
    Objects.requireNonNull(destination, "destination");
  }
}
