package io.doublezero.globalmonitor.infrastructure.icmp;

import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import java.io.IOException;
import java.net.InetAddress;
import java.util.concurrent.TimeoutException;

/**
 * Sends an echo burst through one interface.
 */
public interface IcmpPinger {
  /**
   * @param iface source interface
   * @param destination IPv4 destination
   * @param settings burst shape
   * @param ctx deadline scope
   * @return burst counters
   * @throws TimeoutException when the deadline expires mid-burst
   * @throws IOException on socket or interface errors
   * @throws ProbeCancelledException when the context is cancelled
   */
  IcmpStats ping(String iface, InetAddress destination, IcmpSettings settings, ProbeContext ctx)
      throws IOException, TimeoutException, ProbeCancelledException;
}
