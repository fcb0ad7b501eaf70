package io.doublezero.globalmonitor.domain.solana;

import java.util.Map;

/**
 * Gossip nodes and validators keyed by node identity.
 */
public record SolanaSnapshot(Map<String, GossipNode> gossipNodes, Map<String, Validator> validators) {
  public SolanaSnapshot {
    gossipNodes = Map.copyOf(gossipNodes);
    validators = Map.copyOf(validators);
  }

  public static SolanaSnapshot empty() {
    return new SolanaSnapshot(Map.of(), Map.of());
  }
}
