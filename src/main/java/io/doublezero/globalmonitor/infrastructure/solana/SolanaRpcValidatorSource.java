package io.doublezero.globalmonitor.infrastructure.solana;

import io.doublezero.globalmonitor.application.port.GeoIpResolver;
import io.doublezero.globalmonitor.application.port.MonitorDataException;
import io.doublezero.globalmonitor.application.port.ValidatorSource;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.solana.GossipNode;
import io.doublezero.globalmonitor.domain.solana.SolanaSnapshot;
import io.doublezero.globalmonitor.domain.solana.Validator;
import io.doublezero.globalmonitor.domain.solana.VoteAccount;
import io.doublezero.globalmonitor.infrastructure.json.JsonTree;
import java.io.IOException;
import java.net.InetAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the tick's Solana snapshot from {@code getClusterNodes}, {@code getVoteAccounts} and
 * {@code getLeaderSchedule}.
 *
 * <p>A validator is a gossip node whose identity holds a current or delinquent vote account. Its
 * leader ratio is its share of the epoch's leader slots.</p>
 */
public final class SolanaRpcValidatorSource implements ValidatorSource {
  private static final Logger log = LoggerFactory.getLogger(SolanaRpcValidatorSource.class);

  private final JsonRpcClient rpc;
  private final GeoIpResolver geoIp;

  public SolanaRpcValidatorSource(String rpcUrl, GeoIpResolver geoIp) {
    this(new JsonRpcClient(
        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
        URI.create(Objects.requireNonNull(rpcUrl, "rpcUrl"))), geoIp);
  }

  SolanaRpcValidatorSource(JsonRpcClient rpc, GeoIpResolver geoIp) {
    this.rpc = Objects.requireNonNull(rpc, "rpc");
    this.geoIp = geoIp == null ? GeoIpResolver.NONE : geoIp;
  }

  @Override
  public SolanaSnapshot fetch() throws IOException {
    Map<String, GossipNode> nodes = parseClusterNodes(rpc.call("getClusterNodes"));
    List<VoteAccount> votes = parseVoteAccounts(rpc.call("getVoteAccounts"));
    Map<String, Double> ratios = leaderRatios(rpc.call("getLeaderSchedule"));

    Map<String, Validator> validators = new HashMap<>();
    for (VoteAccount vote : votes) {
      GossipNode node = nodes.get(vote.nodePubkey());
      if (node == null) {
        continue;
      }
      double ratio = ratios.getOrDefault(node.pubkey(), 0.0);
      validators.put(node.pubkey(), new Validator(node, vote, ratio,
          node.gossipIp() == null ? null : geoIp.resolve(node.gossipIp()).orElse(null)));
    }
    log.debug("Solana snapshot gossipNodes={} voteAccounts={} validators={}",
        nodes.size(), votes.size(), validators.size());
    return new SolanaSnapshot(nodes, validators);
  }

  static Map<String, GossipNode> parseClusterNodes(Object result) throws MonitorDataException {
    if (!(result instanceof List<?>)) {
      throw new MonitorDataException("getClusterNodes result is not an array");
    }
    Map<String, GossipNode> nodes = new HashMap<>();
    for (Object item : JsonTree.asArray(result)) {
      Map<String, Object> entry = JsonTree.asObject(item);
      String pubkey = JsonTree.string(entry, "pubkey");
      if (pubkey == null || pubkey.isBlank()) {
        continue;
      }
      String gossip = JsonTree.string(entry, "gossip");
      String tpuQuic = JsonTree.string(entry, "tpuQuic");
      nodes.put(pubkey, new GossipNode(
          pubkey, hostAddress(gossip), port(gossip), hostAddress(tpuQuic), port(tpuQuic)));
    }
    return nodes;
  }

  static List<VoteAccount> parseVoteAccounts(Object result) throws MonitorDataException {
    Map<String, Object> body = JsonTree.asObject(result);
    if (body.isEmpty()) {
      throw new MonitorDataException("getVoteAccounts result is not an object");
    }
    List<VoteAccount> accounts = new ArrayList<>();
    for (String group : List.of("current", "delinquent")) {
      for (Object item : JsonTree.asArray(body.get(group))) {
        Map<String, Object> entry = JsonTree.asObject(item);
        String vote = JsonTree.string(entry, "votePubkey");
        String node = JsonTree.string(entry, "nodePubkey");
        if (vote == null || node == null) {
          continue;
        }
        accounts.add(new VoteAccount(vote, node, JsonTree.number(entry, "activatedStake", 0L)));
      }
    }
    return accounts;
  }

  static Map<String, Double> leaderRatios(Object result) {
    Map<String, Object> schedule = JsonTree.asObject(result);
    long total = 0;
    Map<String, Integer> slots = new HashMap<>();
    for (Map.Entry<String, Object> entry : schedule.entrySet()) {
      int count = JsonTree.asArray(entry.getValue()).size();
      slots.put(entry.getKey(), count);
      total += count;
    }
    Map<String, Double> ratios = new HashMap<>();
    if (total == 0) {
      return ratios;
    }
    for (Map.Entry<String, Integer> entry : slots.entrySet()) {
      ratios.put(entry.getKey(), entry.getValue() / (double) total);
    }
    return ratios;
  }

  private static InetAddress hostAddress(String hostPort) {
    return Ipv4.parse(Ipv4.hostOf(hostPort));
  }

  private static int port(String hostPort) {
    if (Ipv4.hostOf(hostPort) == null) {
      return 0;
    }
    try {
      return Integer.parseInt(hostPort.substring(hostPort.lastIndexOf(':') + 1));
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
