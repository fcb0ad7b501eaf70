package io.doublezero.globalmonitor.domain.probe;

/**
 * Classification of an unsuccessful probe.
 *
 * <p>{@link #NOT_READY} marks a measurement artifact rather than a network health signal; such
 * results are counted but never written to the measurement sink.</p>
 */
public enum ProbeFailReason {
  /** Preflight found no route to the destination. */
  NO_ROUTE("no-route"),
  /** Packets were sent and none came back. */
  PACKETS_LOST("packets-lost"),
  /** Protocol counters had not stabilized within the allotted wait. */
  NOT_READY("not-ready"),
  /** Deadline exceeded during send, dial or readiness wait. */
  TIMEOUT("timeout"),
  /** Any unclassified protocol or dial error. */
  OTHER("other");

  private final String label;

  ProbeFailReason(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return label;
  }
}
