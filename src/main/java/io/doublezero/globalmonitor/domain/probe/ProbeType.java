package io.doublezero.globalmonitor.domain.probe;

/**
 * Probe protocol family. The label prefixes target ids and is written as the {@code probe_type} tag.
 */
public enum ProbeType {
  ICMP("icmp"),
  TPUQUIC("tpuquic");

  private final String label;

  ProbeType(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
