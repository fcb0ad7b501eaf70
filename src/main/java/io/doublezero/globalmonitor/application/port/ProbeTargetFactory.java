package io.doublezero.globalmonitor.application.port;

import java.net.InetAddress;

/**
 * Creates protocol-specific probe targets for planners.
 */
public interface ProbeTargetFactory {
  ProbeTarget icmp(String iface, InetAddress ip, Preflight preflight);

  ProbeTarget tpuQuic(String iface, String hostPort, Preflight preflight);
}
