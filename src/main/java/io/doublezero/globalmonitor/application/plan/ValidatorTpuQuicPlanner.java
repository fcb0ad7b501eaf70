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
import io.doublezero.globalmonitor.domain.solana.GossipNode;
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
 * QUIC handshake probes to validator TPU QUIC endpoints, over the public internet and, when a
 * DoubleZero user owns the endpoint's address, over the overlay.
 */
public final class ValidatorTpuQuicPlanner extends AbstractProbePlanner {
  private static final Logger log = LoggerFactory.getLogger(ValidatorTpuQuicPlanner.class);

  public ValidatorTpuQuicPlanner(ProbeTargetFactory targets) {
    super(targets);
  }

  @Override
  public PlanKind kind() {
    return PlanKind.SOL_VAL_TPUQUIC;
  }

  @Override
  public PlanBatch buildPlans(TickInputs inputs) {
    Source source = inputs.source();
    Map<String, List<Validator>> byAddr = new LinkedHashMap<>();
    Map<String, List<Validator>> byIp = new LinkedHashMap<>();
    for (Validator validator : inputs.solana().validators().values()) {
      GossipNode node = validator.node();
      Optional<String> addr = node.tpuQuicAddr();
      if (addr.isEmpty() || !Ipv4.usable(node.tpuQuicIp())) {
        continue;
      }
      byAddr.computeIfAbsent(addr.get(), k -> new ArrayList<>()).add(validator);
      byIp.computeIfAbsent(Ipv4.text(node.tpuQuicIp()), k -> new ArrayList<>()).add(validator);
    }

    TargetCollector collector = new TargetCollector();
    for (Map.Entry<String, List<Validator>> entry : byAddr.entrySet()) {
      String addr = entry.getKey();
      ProbeTargetId id = ProbeTargetId.tpuquic(source.publicIface(), addr);
      for (Validator validator : entry.getValue()) {
        collector.add(validator.pubkey(), id,
            () -> targets.tpuQuic(source.publicIface(), addr, Preflight.NONE));
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
      List<Validator> validators = byIp.get(dzIp);
      if (validators == null || sameExchange(source, user)) {
        continue;
      }
      for (Validator validator : validators) {
        Optional<String> addr = validator.node().tpuQuicAddr();
        if (addr.isEmpty()) {
          continue;
        }
        ProbeTargetId id = ProbeTargetId.tpuquic(source.dzIface(), addr.get());
        collector.add(validator.pubkey(), id,
            () -> targets.tpuQuic(source.dzIface(), addr.get(), routePreflight(inputs.routes(), dzIp)));
      }
    }
    return collector.toBatch(kind(), source);
  }

  @Override
  public Optional<MeasurementPoint> recordEntity(
      TickInputs inputs, ProbePlan plan, String entityKey, ProbeResult result) {
    Validator validator = inputs.solana().validators().get(entityKey);
    if (validator == null || !Ipv4.usable(validator.node().tpuQuicIp())) {
      return Optional.empty();
    }
    Source source = inputs.source();
    InetAddress targetIp = validator.node().tpuQuicIp();
    String host = Ipv4.hostOf(plan.destination());
    User targetUser = host == null ? null : inputs.registry().usersByDzIp().get(host);

    PointBuilder point = new PointBuilder(kind().table(), kind().probeType())
        .tag("validator_pubkey", validator.pubkey())
        .targetIp(targetIp)
        .tag("target_port", Integer.toString(validator.node().tpuQuicPort()))
        .tag("target_endpoint", plan.destination())
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
