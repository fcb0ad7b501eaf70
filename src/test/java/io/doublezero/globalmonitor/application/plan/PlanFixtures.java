package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.application.port.GeoIpResolver;
import io.doublezero.globalmonitor.application.port.Preflight;
import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.application.port.ProbeTargetFactory;
import io.doublezero.globalmonitor.application.probe.FakeProbeTarget;
import io.doublezero.globalmonitor.domain.dz.Device;
import io.doublezero.globalmonitor.domain.dz.Exchange;
import io.doublezero.globalmonitor.domain.dz.RegistrySnapshot;
import io.doublezero.globalmonitor.domain.dz.User;
import io.doublezero.globalmonitor.domain.dz.UserType;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.net.Route;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import io.doublezero.globalmonitor.domain.solana.GossipNode;
import io.doublezero.globalmonitor.domain.solana.SolanaSnapshot;
import io.doublezero.globalmonitor.domain.solana.Validator;
import io.doublezero.globalmonitor.domain.solana.VoteAccount;
import java.net.InetAddress;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared world used by planner and runner tests.
 *
 * <p>The source sits in Amsterdam. {@code UserFra} is an overlay user in Frankfurt whose overlay
 * address is also the gossip and TPU QUIC address of validator {@code ValA}. {@code UserAms} shares
 * the source's exchange and owns the gossip address of {@code ValD}. {@code ValB} and {@code ValC}
 * share a public endpoint.</p>
 */
public final class PlanFixtures {
  public static final String PUBLIC_IFACE = "eth0";
  public static final String DZ_IFACE = "doublezero0";
  public static final Instant TICK_TIME = Instant.parse("2026-03-01T12:00:00Z");

  public static final Exchange XAMS = new Exchange("ExAms", "xams", "Amsterdam");
  public static final Exchange XFRA = new Exchange("ExFra", "xfra", "Frankfurt");
  public static final Device AMS_DZD = new Device("DevAms", "ams-dz01", XAMS);
  public static final Device FRA_DZD = new Device("DevFra", "fra-dz01", XFRA);

  public static final User SOURCE_USER =
      new User("UserSrc", UserType.IBRL, ip("198.51.100.10"), ip("100.64.0.1"), "", AMS_DZD);
  public static final User USER_FRA =
      new User("UserFra", UserType.IBRL, ip("203.0.113.5"), ip("100.64.0.5"), "ValA", FRA_DZD);
  public static final User USER_AMS =
      new User("UserAms", UserType.IBRL, ip("203.0.113.6"), ip("100.64.0.6"), "", AMS_DZD);
  public static final User USER_MCAST =
      new User("UserMc", UserType.MULTICAST, ip("203.0.113.7"), ip("100.64.0.7"), "", FRA_DZD);

  public static final Validator VAL_A = validator("ValA", "VoteA", "100.64.0.5", 8009, 1_000L, 0.25);
  public static final Validator VAL_B = validator("ValB", "VoteB", "192.0.2.20", 8009, 2_000L, 0.5);
  public static final Validator VAL_C = validator("ValC", "VoteC", "192.0.2.20", 8009, 3_000L, 0.0);
  public static final Validator VAL_D = validator("ValD", "VoteD", "100.64.0.6", 0, 4_000L, 0.25);

  private PlanFixtures() {
    // Utility
  }

  public static InetAddress ip(String text) {
    return Ipv4.parse(text);
  }

  public static Source overlaySource() {
    return new Source(
        PUBLIC_IFACE, ip("198.51.100.10"), DZ_IFACE, ip("100.64.0.1"), "ams", "Amsterdam", "gm-ams-1",
        SOURCE_USER);
  }

  public static Source publicSource() {
    return overlaySource().withoutOverlay();
  }

  public static RegistrySnapshot registry() {
    return RegistrySnapshot.of(
        List.of(SOURCE_USER, USER_FRA, USER_AMS, USER_MCAST),
        List.of(AMS_DZD, FRA_DZD),
        List.of(XAMS, XFRA));
  }

  public static SolanaSnapshot solana() {
    Map<String, GossipNode> nodes = new LinkedHashMap<>();
    Map<String, Validator> validators = new LinkedHashMap<>();
    for (Validator v : List.of(VAL_A, VAL_B, VAL_C, VAL_D)) {
      nodes.put(v.pubkey(), v.node());
      validators.put(v.pubkey(), v);
    }
    GossipNode spy = new GossipNode("Spy", ip("192.0.2.99"), 8001, null, 0);
    nodes.put(spy.pubkey(), spy);
    return new SolanaSnapshot(nodes, validators);
  }

  /** Routes covering every overlay destination in the fixture. */
  public static Map<String, Route> routes() {
    Map<String, Route> routes = new LinkedHashMap<>();
    for (String dst : List.of("100.64.0.5", "100.64.0.6", "100.64.0.7")) {
      routes.put(dst, new Route(dst, DZ_IFACE, "bgp"));
    }
    return routes;
  }

  public static TickInputs overlayInputs() {
    return new TickInputs(solana(), registry(), overlaySource(), routes());
  }

  public static TickInputs publicInputs() {
    return new TickInputs(solana(), registry(), publicSource(), Map.of());
  }

  public static List<ProbePlanner> planners(ProbeTargetFactory factory) {
    return List.of(
        new ValidatorIcmpPlanner(factory),
        new ValidatorTpuQuicPlanner(factory),
        new UserIcmpPlanner(factory, GeoIpResolver.NONE));
  }

  private static Validator validator(
      String pubkey, String vote, String ip, int tpuPort, long stake, double leaderRatio) {
    InetAddress address = ip(ip);
    GossipNode node = new GossipNode(pubkey, address, 8001, tpuPort > 0 ? address : null, tpuPort);
    return new Validator(node, new VoteAccount(vote, pubkey, stake), leaderRatio, null);
  }

  /** Factory handing out {@link FakeProbeTarget}s and remembering every instance it made. */
  public static final class FakeTargetFactory implements ProbeTargetFactory {
    private final List<FakeProbeTarget> created = new ArrayList<>();

    @Override
    public synchronized ProbeTarget icmp(String iface, InetAddress ip, Preflight preflight) {
      return remember(new FakeProbeTarget(ProbeTargetId.icmp(iface, Ipv4.text(ip)), preflight));
    }

    @Override
    public synchronized ProbeTarget tpuQuic(String iface, String hostPort, Preflight preflight) {
      return remember(new FakeProbeTarget(ProbeTargetId.tpuquic(iface, hostPort), preflight));
    }

    public synchronized List<FakeProbeTarget> created() {
      return List.copyOf(created);
    }

    private FakeProbeTarget remember(FakeProbeTarget target) {
      created.add(target);
      return target;
    }
  }
}
