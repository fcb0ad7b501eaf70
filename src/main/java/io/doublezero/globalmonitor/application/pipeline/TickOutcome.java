package io.doublezero.globalmonitor.application.pipeline;

import io.doublezero.globalmonitor.domain.probe.PlanKind;

/**
 * How a tick ended; the label is the {@code outcome} attribute of the tick counter.
 */
public enum TickOutcome {
  OK("ok"),
  SOLANA_ERR("solana_err"),
  DZ_SVC_ERR("dz_svc_err"),
  SOURCE_ERR("source_err"),
  ROUTES_ERR("routes_err"),
  SOL_VAL_ICMP_PLANS_ERR("sol_val_icmp_plans_err"),
  SOL_VAL_TPUQUIC_PLANS_ERR("sol_val_tpuquic_plans_err"),
  DZ_USER_ICMP_PLANS_ERR("dz_user_icmp_plans_err"),
  PROBES_ERR("probes_err");

  private final String label;

  TickOutcome(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  static TickOutcome plansError(PlanKind kind) {
    return switch (kind) {
      case SOL_VAL_ICMP -> SOL_VAL_ICMP_PLANS_ERR;
      case SOL_VAL_TPUQUIC -> SOL_VAL_TPUQUIC_PLANS_ERR;
      case DZ_USER_ICMP -> DZ_USER_ICMP_PLANS_ERR;
    };
  }
}
