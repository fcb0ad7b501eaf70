package io.doublezero.globalmonitor.domain.probe;

/**
 * Probe scenario. Each kind is produced by exactly one planner and writes to its own table.
 */
public enum PlanKind {
  SOL_VAL_ICMP("sol_val_icmp", ProbeType.ICMP, "solana_validator_icmp_probe"),
  SOL_VAL_TPUQUIC("sol_val_tpuquic", ProbeType.TPUQUIC, "solana_validator_tpuquic_probe"),
  DZ_USER_ICMP("dz_user_icmp", ProbeType.ICMP, "doublezero_user_icmp_probe");

  private final String label;
  private final ProbeType probeType;
  private final String table;

  PlanKind(String label, ProbeType probeType, String table) {
    this.label = label;
    this.probeType = probeType;
    this.table = table;
  }

  public String label() {
    return label;
  }

  public ProbeType probeType() {
    return probeType;
  }

  /** Measurement table the kind's points are written to. */
  public String table() {
    return table;
  }

  @Override
  public String toString() {
    return label;
  }
}
