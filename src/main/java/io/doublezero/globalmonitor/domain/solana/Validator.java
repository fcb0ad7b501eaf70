package io.doublezero.globalmonitor.domain.solana;

import io.doublezero.globalmonitor.domain.net.GeoIpRecord;
import java.util.Objects;

/**
 * Gossip node that also holds a vote account.
 *
 * @param node gossip entry
 * @param voteAccount vote account
 * @param leaderRatio share of leader slots in the current epoch schedule
 * @param geoIp GeoIP annotation of the gossip address, may be {@code null}
 */
public record Validator(GossipNode node, VoteAccount voteAccount, double leaderRatio, GeoIpRecord geoIp) {
  public Validator {
    Objects.requireNonNull(node, "node");
    Objects.requireNonNull(voteAccount, "voteAccount");
  }

  public String pubkey() {
    return node.pubkey();
  }
}
