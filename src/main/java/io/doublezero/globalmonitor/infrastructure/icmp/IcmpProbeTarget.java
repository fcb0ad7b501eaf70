package io.doublezero.globalmonitor.infrastructure.icmp;

import io.doublezero.globalmonitor.application.port.Preflight;
import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.probe.ProbeException;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeStats;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ICMP echo target. Stateless between probes, so {@link #close()} does nothing.
 */
public final class IcmpProbeTarget implements ProbeTarget {
  private static final Logger log = LoggerFactory.getLogger(IcmpProbeTarget.class);

  private final String iface;
  private final InetAddress ip;
  private final ProbeTargetId id;
  private final Preflight preflight;
  private final IcmpSettings settings;
  private final IcmpPinger pinger;

  public IcmpProbeTarget(
      String iface, InetAddress ip, Preflight preflight, IcmpSettings settings, IcmpPinger pinger) {
    if (iface == null || iface.isBlank()) {
      throw new IllegalArgumentException("iface is required");
    }
    if (!Ipv4.usable(ip)) {
      throw new IllegalArgumentException("ip must be a specified IPv4 address: " + ip);
    }
    this.iface = iface;
    this.ip = ip;
    this.id = ProbeTargetId.icmp(iface, Ipv4.text(ip));
    this.preflight = preflight == null ? Preflight.NONE : preflight;
    this.settings = settings == null ? IcmpSettings.defaults() : settings;
    this.pinger = Objects.requireNonNull(pinger, "pinger");
  }

  @Override
  public ProbeTargetId id() {
    return id;
  }

  @Override
  public String iface() {
    return iface;
  }

  public InetAddress ip() {
    return ip;
  }

  @Override
  public ProbeResult probe(ProbeContext ctx) throws ProbeCancelledException {
    Optional<ProbeFailReason> blocked = preflight.check(ctx);
    if (blocked.isPresent()) {
      return ProbeResult.failure(blocked.get(), new ProbeException("preflight failed: " + blocked.get()));
    }

    IcmpStats raw;
    try {
      raw = pinger.ping(iface, ip, settings, ctx);
    } catch (TimeoutException ex) {
      return ProbeResult.failure(ProbeFailReason.TIMEOUT, ex);
    } catch (IOException ex) {
      if (ctx.deadlineExceeded()) {
        return ProbeResult.failure(ProbeFailReason.TIMEOUT, ex);
      }
      log.debug("icmp probe {} failed", id, ex);
      return ProbeResult.failure(ProbeFailReason.OTHER, ex);
    }

    if (raw == null || raw.looksUntouched()) {
      return ProbeResult.failure(ProbeFailReason.NOT_READY, new ProbeException("stats not ready"));
    }
    ProbeStats stats = ProbeStats.of(raw.sent(), raw.received(), raw.rttMin(), raw.rttAvg(), raw.rttStdDev());
    if (stats.packetsSent() > 0 && stats.packetsReceived() == 0) {
      return ProbeResult.failure(
          ProbeFailReason.PACKETS_LOST, stats, new ProbeException("no packets received"));
    }
    return ProbeResult.success(stats);
  }

  @Override
  public void close() {
    // connectionless
  }

  @Override
  public String toString() {
    return id.toString();
  }
}
