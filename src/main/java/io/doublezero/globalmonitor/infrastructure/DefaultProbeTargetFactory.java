package io.doublezero.globalmonitor.infrastructure;

import io.doublezero.globalmonitor.application.port.Preflight;
import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.application.port.ProbeTargetFactory;
import io.doublezero.globalmonitor.infrastructure.icmp.IcmpPinger;
import io.doublezero.globalmonitor.infrastructure.icmp.IcmpProbeTarget;
import io.doublezero.globalmonitor.infrastructure.icmp.IcmpSettings;
import io.doublezero.globalmonitor.infrastructure.quic.QuicDialConfig;
import io.doublezero.globalmonitor.infrastructure.quic.QuicDialer;
import io.doublezero.globalmonitor.infrastructure.quic.QuicProbeTarget;
import java.net.InetAddress;
import java.util.Objects;

/**
 * Creates ICMP and TPU QUIC targets sharing one pinger and one dialer.
 */
public final class DefaultProbeTargetFactory implements ProbeTargetFactory {
  private final IcmpPinger pinger;
  private final IcmpSettings icmpSettings;
  private final QuicDialer dialer;
  private final QuicDialConfig dialConfig;

  public DefaultProbeTargetFactory(
      IcmpPinger pinger, IcmpSettings icmpSettings, QuicDialer dialer, QuicDialConfig dialConfig) {
    this.pinger = Objects.requireNonNull(pinger, "pinger");
    this.icmpSettings = icmpSettings == null ? IcmpSettings.defaults() : icmpSettings;
    this.dialer = Objects.requireNonNull(dialer, "dialer");
    this.dialConfig = dialConfig == null ? QuicDialConfig.defaults() : dialConfig;
  }

  @Override
  public ProbeTarget icmp(String iface, InetAddress ip, Preflight preflight) {
    return new IcmpProbeTarget(iface, ip, preflight, icmpSettings, pinger);
  }

  @Override
  public ProbeTarget tpuQuic(String iface, String hostPort, Preflight preflight) {
    return new QuicProbeTarget(iface, hostPort, dialConfig, preflight, dialer);
  }
}
