package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.application.port.GeoIpResolver;
import io.doublezero.globalmonitor.application.port.Preflight;
import io.doublezero.globalmonitor.application.port.ProbeTargetFactory;
import io.doublezero.globalmonitor.domain.dz.User;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.probe.MeasurementPoint;
import io.doublezero.globalmonitor.domain.probe.PlanKind;
import io.doublezero.globalmonitor.domain.probe.ProbePath;
import io.doublezero.globalmonitor.domain.probe.ProbePlan;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import io.doublezero.globalmonitor.domain.solana.GossipNode;
import io.doublezero.globalmonitor.domain.solana.PublicKeys;
import io.doublezero.globalmonitor.domain.solana.Validator;
import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ICMP probes to DoubleZero users: client IPs over the public internet, overlay IPs over the
 * overlay. Multicast users are left out of overlay probing.
 */
public final class UserIcmpPlanner extends AbstractProbePlanner {
  private static final Logger log = LoggerFactory.getLogger(UserIcmpPlanner.class);

  private final GeoIpResolver geoIp;

  public UserIcmpPlanner(ProbeTargetFactory targets, GeoIpResolver geoIp) {
    super(targets);
    this.geoIp = Objects.requireNonNull(geoIp, "geoIp");
  }

  @Override
  public PlanKind kind() {
    return PlanKind.DZ_USER_ICMP;
  }

  @Override
  public PlanBatch buildPlans(TickInputs inputs) {
    Source source = inputs.source();
    TargetCollector collector = new TargetCollector();
    for (User user : inputs.registry().usersByPubkey().values()) {
      if (!Ipv4.usable(user.clientIp())) {
        continue;
      }
      ProbeTargetId id = ProbeTargetId.icmp(source.publicIface(), Ipv4.text(user.clientIp()));
      collector.add(user.pubkey(), id,
          () -> targets.icmp(source.publicIface(), user.clientIp(), Preflight.NONE));
    }

    if (!source.overlayActive()) {
      return collector.toBatch(kind(), source);
    }

    for (User user : inputs.registry().usersByPubkey().values()) {
      if (!Ipv4.usable(user.dzIp()) || sameExchange(source, user) || user.multicast()) {
        continue;
      }
      String dzIp = Ipv4.text(user.dzIp());
      ProbeTargetId id = ProbeTargetId.icmp(source.dzIface(), dzIp);
      collector.add(user.pubkey(), id,
          () -> targets.icmp(source.dzIface(), user.dzIp(), routePreflight(inputs.routes(), dzIp)));
    }
    return collector.toBatch(kind(), source);
  }

  @Override
  public Optional<MeasurementPoint> recordEntity(
      TickInputs inputs, ProbePlan plan, String entityKey, ProbeResult result) {
    User user = inputs.registry().usersByPubkey().get(entityKey);
    if (user == null) {
      return Optional.empty();
    }
    Source source = inputs.source();
    PointBuilder point = new PointBuilder(kind().table(), kind().probeType())
        .tag("user_pubkey", user.pubkey())
        .source(source);
    if (source.user() != null) {
      point.tag("source_user_pubkey", source.user().pubkey());
    }
    point.sourceDevice(source.user()).targetDevice(user);

    Optional<ProbePath> path = point.path(source, plan.iface());
    if (path.isEmpty()) {
      log.error("Unknown source interface {} recording user {} target {}",
          plan.iface(), user.pubkey(), plan.id());
      return Optional.empty();
    }
    InetAddress targetIp = path.get() == ProbePath.DOUBLEZERO ? user.dzIp() : user.clientIp();
    if (Ipv4.usable(targetIp)) {
      point.targetIp(targetIp);
    }
    if (user.clientIp() != null) {
      point.geoIp(geoIp.resolve(user.clientIp()).orElse(null));
    }

    if (!PublicKeys.isZero(user.validatorPubkey())) {
      point.tag("user_validator_pubkey", user.validatorPubkey());
      Validator validator = inputs.solana().validators().get(user.validatorPubkey());
      point.field("user_validator_pubkey_in_solana_vote_accounts", validator != null);
      if (validator != null && !PublicKeys.isZero(validator.voteAccount().votePubkey())) {
        point.tag("validator_vote_pubkey", validator.voteAccount().votePubkey());
      }
      point.field("user_validator_pubkey_in_solana_gossip",
          inputs.solana().gossipNodes().containsKey(user.validatorPubkey()));
    }

    InetAddress probed = Ipv4.parse(plan.destination());
    if (Ipv4.usable(probed)) {
      String probedText = Ipv4.text(probed);
      boolean inGossip = false;
      boolean asTpuQuic = false;
      for (GossipNode node : inputs.solana().gossipNodes().values()) {
        if (Ipv4.usable(node.gossipIp()) && Ipv4.text(node.gossipIp()).equals(probedText)) {
          inGossip = true;
        }
        if (Ipv4.usable(node.tpuQuicIp()) && Ipv4.text(node.tpuQuicIp()).equals(probedText)) {
          asTpuQuic = true;
        }
      }
      point.field("target_ip_in_solana_gossip", inGossip);
      point.field("target_ip_in_solana_gossip_as_tpuquic", asTpuQuic);
    }
    return point.outcome(result, log, plan.id().toString());
  }
}
