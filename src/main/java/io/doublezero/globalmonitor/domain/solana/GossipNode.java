package io.doublezero.globalmonitor.domain.solana;

import io.doublezero.globalmonitor.domain.net.Ipv4;
import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Cluster node as advertised in gossip.
 *
 * @param pubkey node identity
 * @param gossipIp gossip address, may be {@code null}
 * @param gossipPort gossip port, zero when absent
 * @param tpuQuicIp TPU QUIC address, may be {@code null}
 * @param tpuQuicPort TPU QUIC port, zero when absent
 */
public record GossipNode(
    String pubkey, InetAddress gossipIp, int gossipPort, InetAddress tpuQuicIp, int tpuQuicPort) {

  public GossipNode {
    Objects.requireNonNull(pubkey, "pubkey");
  }

  /** {@code host:port} of the TPU QUIC endpoint when both parts are present. */
  public Optional<String> tpuQuicAddr() {
    if (tpuQuicIp == null || tpuQuicPort <= 0) {
      return Optional.empty();
    }
    return Optional.of(Ipv4.hostPort(tpuQuicIp, tpuQuicPort));
  }
}
