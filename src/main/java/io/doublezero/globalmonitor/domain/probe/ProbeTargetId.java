package io.doublezero.globalmonitor.domain.probe;

import java.util.Objects;

/**
 * Deterministic identity of a probe target: protocol, source interface and destination.
 *
 * <p>Two targets with equal ids are the same target; the id stays stable across ticks as long as
 * the tuple is unchanged. Rendered as {@code <type>/<iface>/<destination>}.</p>
 *
 * @param type protocol family
 * @param iface source interface name
 * @param destination IP address for ICMP, {@code host:port} for QUIC
 */
public record ProbeTargetId(ProbeType type, String iface, String destination) {
  public ProbeTargetId {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(iface, "iface");
    Objects.requireNonNull(destination, "destination");
  }

  public static ProbeTargetId icmp(String iface, String ip) {
    return new ProbeTargetId(ProbeType.ICMP, iface, ip);
  }

  public static ProbeTargetId tpuquic(String iface, String hostPort) {
    return new ProbeTargetId(ProbeType.TPUQUIC, iface, hostPort);
  }

  @Override
  public String toString() {
    return type.label() + "/" + iface + "/" + destination;
  }
}
