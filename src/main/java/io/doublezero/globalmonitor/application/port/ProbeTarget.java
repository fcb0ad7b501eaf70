package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import java.util.concurrent.TimeoutException;

/**
 * <strong>What:</strong> A probeable destination reached through one local interface.
 * <p><strong>Why:</strong> Lets the target registry run ICMP and QUIC probes through one contract.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code IcmpProbeTarget} and {@code QuicProbeTarget}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose a deterministic {@link ProbeTargetId}.</li>
 *   <li>Convert protocol errors into {@link ProbeResult} failures instead of throwing.</li>
 *   <li>Release protocol resources on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The registry never probes and closes a target at the same time;
 * implementations with mutable state guard it themselves.</p>
 */
public interface ProbeTarget {
  ProbeTargetId id();

  /** Source interface name the probe egresses through. */
  String iface();

  /**
   * Runs one probe within the context's deadline.
   *
   * @param ctx cancellation and deadline scope
   * @return result; never {@code null} for well-behaved implementations
   * @throws ProbeCancelledException when the context is cancelled
   * @throws TimeoutException when the deadline expires in a way the target does not classify itself
   */
  ProbeResult probe(ProbeContext ctx) throws ProbeCancelledException, TimeoutException;

  /** Releases any cached protocol state. Idempotent. */
  void close();
}
