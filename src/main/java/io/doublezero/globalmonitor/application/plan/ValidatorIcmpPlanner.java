package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.application.port.Preflight;
import io.doublezero.globalmonitor.application.port.ProbeTargetFactory;
import io.doublezero.globalmonitor.domain.dz.User;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.probe.MeasurementPoint;
import io.doublezero.globalmonitor.domain.probe.PlanKind;
import io.doublezero.globalmonitor.domain.probe.ProbePlan;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import io.doublezero.globalmonitor.domain.solana.PublicKeys;
import io.doublezero.globalmonitor.domain.solana.Validator;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ICMP probes to validator gossip addresses, over the public internet and, when a DoubleZero user
 * owns the gossip address, over the overlay.
 */
public final class ValidatorIcmpPlanner extends AbstractProbePlanner {
  private static final Logger log = LoggerFactory.getLogger(ValidatorIcmpPlanner.class);

  public ValidatorIcmpPlanner(ProbeTargetFactory targets) {
    super(targets);
  }

  @Override
  public PlanKind kind() {
    return PlanKind.SOL_VAL_ICMP;
  }

  @Override
  public PlanBatch buildPlans(TickInputs inputs) {
    Source source = inputs.source();
    Map<String, List<Validator>> byGossipIp = new LinkedHashMap<>();
    for (Validator validator : inputs.solana().validators().values()) {
      InetAddress ip = validator.node().gossipIp();
      if (!Ipv4.usable(ip)) {
        continue;
      }
      byGossipIp.computeIfAbsent(Ipv4.text(ip), k -> new ArrayList<>()).add(validator);
    }

    TargetCollector collector = new TargetCollector();
    for (List<Validator> validators : byGossipIp.values()) {
      for (Validator validator : validators) {
        InetAddress ip = validator.node().gossipIp();
        ProbeTargetId id = ProbeTargetId.icmp(source.publicIface(), Ipv4.text(ip));
        collector.add(validator.pubkey(), id,
            () -> targets.icmp(source.publicIface(), ip, Preflight.NONE));
      }
    }

    if (!source.overlayActive()) {
      return collector.toBatch(kind(), source);
    }

    for (User user : inputs.registry().usersByPubkey().values()) {
      if (!Ipv4.usable(user.dzIp())) {
        continue;
      }
      String dzIp = Ipv4.text(user.dzIp());
      List<Validator> validators = byGossipIp.get(dzIp);
      if (validators == null || sameExchange(source, user)) {
        continue;
      }
      for (Validator validator : validators) {
        ProbeTargetId id = ProbeTargetId.icmp(source.dzIface(), dzIp);
        collector.add(validator.pubkey(), id,
            () -> targets.icmp(source.dzIface(), user.dzIp(), routePreflight(inputs.routes(), dzIp)));
      }
    }
    return collector.toBatch(kind(), source);
  }

  @Override
  public Optional<MeasurementPoint> recordEntity(
      TickInputs inputs, ProbePlan plan, String entityKey, ProbeResult result) {
    Validator validator = inputs.solana().validators().get(entityKey);
    if (validator == null || !Ipv4.usable(validator.node().gossipIp())) {
      return Optional.empty();
    }
    Source source = inputs.source();
    InetAddress targetIp = validator.node().gossipIp();
    User targetUser = inputs.registry().usersByDzIp().get(Ipv4.text(targetIp));

    PointBuilder point = new PointBuilder(kind().table(), kind().probeType())
        .tag("validator_pubkey", validator.pubkey())
        .targetIp(targetIp)
        .source(source)
        .field("validator_leader_ratio", validator.leaderRatio())
        .field("validator_stake_lamports", validator.voteAccount().activatedStake());
    if (!PublicKeys.isZero(validator.voteAccount().votePubkey())) {
      point.tag("validator_vote_pubkey", validator.voteAccount().votePubkey());
    }
    point.sourceDevice(source.user()).targetDevice(targetUser);
    if (point.path(source, plan.iface()).isEmpty()) {
      log.error("Unknown source interface {} recording validator {} target {}",
          plan.iface(), validator.pubkey(), plan.id());
      return Optional.empty();
    }
    point.geoIp(validator.geoIp());
    return point.outcome(result, log, plan.id().toString());
  }
}
