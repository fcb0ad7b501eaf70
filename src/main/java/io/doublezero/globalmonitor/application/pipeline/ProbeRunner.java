package io.doublezero.globalmonitor.application.pipeline;

import io.doublezero.globalmonitor.application.plan.PlanBatch;
import io.doublezero.globalmonitor.application.plan.ProbePlanner;
import io.doublezero.globalmonitor.application.plan.TickInputs;
import io.doublezero.globalmonitor.application.port.ClockPort;
import io.doublezero.globalmonitor.application.port.MetricsPort;
import io.doublezero.globalmonitor.application.port.NetworkRegistrySource;
import io.doublezero.globalmonitor.application.port.PointSink;
import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.application.port.RouteSource;
import io.doublezero.globalmonitor.application.port.ValidatorSource;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.application.probe.TargetSet;
import io.doublezero.globalmonitor.application.source.SourceResolver;
import io.doublezero.globalmonitor.domain.dz.RegistrySnapshot;
import io.doublezero.globalmonitor.domain.net.Route;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.probe.ProbePlan;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import io.doublezero.globalmonitor.domain.solana.SolanaSnapshot;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Tick driver of the monitor.
 * <p><strong>Why:</strong> Gathers the tick's snapshots, plans probes, runs them through the
 * {@link TargetSet} and records the results.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Tick immediately, then once per interval until {@link #stop()}; ticks never overlap.</li>
 *   <li>Abandon a tick without touching targets when any snapshot cannot be fetched.</li>
 *   <li>Emit per-plan outcome counters, measurement points and per-bucket summaries.</li>
 *   <li>Close every live target on shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run()} is called from one thread; {@link #stop()} may be
 * called from any thread.</p>
 */
public final class ProbeRunner {
  private static final Logger log = LoggerFactory.getLogger(ProbeRunner.class);

  private final RunnerSettings settings;
  private final ValidatorSource validators;
  private final NetworkRegistrySource registry;
  private final SourceResolver sourceResolver;
  private final RouteSource routes;
  private final List<ProbePlanner> planners;
  private final TargetSet targets;
  private final PointSink sink;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ProbeContext root = ProbeContext.background();
  private final CountDownLatch stopSignal = new CountDownLatch(1);

  public ProbeRunner(
      RunnerSettings settings,
      ValidatorSource validators,
      NetworkRegistrySource registry,
      SourceResolver sourceResolver,
      RouteSource routes,
      List<ProbePlanner> planners,
      TargetSet targets,
      PointSink sink,
      MetricsPort metrics,
      ClockPort clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.validators = Objects.requireNonNull(validators, "validators");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.sourceResolver = Objects.requireNonNull(sourceResolver, "sourceResolver");
    this.routes = Objects.requireNonNull(routes, "routes");
    this.planners = List.copyOf(planners);
    this.targets = Objects.requireNonNull(targets, "targets");
    this.sink = sink == null ? PointSink.NO_OP : sink;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs ticks until {@link #stop()} is called, then closes every live target.
   *
   * @throws IOException when the vantage point cannot be resolved at startup
   */
  public void run() throws IOException {
    MDC.put("pipeline", "monitor");
    try {
      Source initial = sourceResolver.resolvePublic();
      log.info("Runner starting probeInterval={} publicIface={} publicIp={} dzIface={} metro={} metroName={} host={}",
          settings.probeInterval(), initial.publicIface(), initial.publicIp().getHostAddress(),
          sourceResolver.settings().dzIface(), initial.metro(), initial.metroName(), initial.host());
      if (sink == PointSink.NO_OP) {
        log.warn("No measurement sink configured; probe results will not be written");
      }
      if (!settings.overlayConfigured()) {
        log.warn("No overlay interface configured; skipping doublezero probing");
      }

      long intervalNanos = settings.probeInterval().toNanos();
      long next = System.nanoTime();
      while (!root.isCancelled()) {
        tick(root);
        next += intervalNanos;
        long now = System.nanoTime();
        if (next - now <= 0) {
          long missed = (now - next) / intervalNanos + 1;
          next += missed * intervalNanos;
        }
        try {
          if (stopSignal.await(next - System.nanoTime(), TimeUnit.NANOSECONDS)) {
            break;
          }
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          break;
        }
      }
      log.info("Runner stopping; closing {} targets", targets.size());
      targets.prune(null);
    } finally {
      MDC.remove("pipeline");
    }
  }

  /** Requests shutdown; in-flight probes observe cancellation. */
  public void stop() {
    root.cancel();
    stopSignal.countDown();
  }

  /**
   * Runs one tick and records its outcome and duration.
   */
  TickOutcome tick(ProbeContext ctx) {
    Instant started = clock.now();
    TickOutcome outcome = runTick(ctx, started);
    metrics.observe(MonitorMetrics.TICK_DURATION_MS, Duration.between(started, clock.now()).toMillis());
    metrics.increment(MonitorMetrics.TICK_TOTAL, MonitorMetrics.outcomeLabels(outcome));
    return outcome;
  }

  private TickOutcome runTick(ProbeContext ctx, Instant started) {
    SolanaSnapshot solana;
    try {
      solana = validators.fetch();
    } catch (IOException | RuntimeException ex) {
      log.error("Failed to get solana gossip nodes and validators", ex);
      return TickOutcome.SOLANA_ERR;
    }

    RegistrySnapshot snapshot;
    try {
      snapshot = registry.fetch();
    } catch (IOException | RuntimeException ex) {
      log.error("Failed to get doublezero registry data", ex);
      return TickOutcome.DZ_SVC_ERR;
    }

    Source source;
    try {
      source = sourceResolver.resolve(snapshot);
    } catch (IOException | RuntimeException ex) {
      log.error("Failed to resolve source", ex);
      return TickOutcome.SOURCE_ERR;
    }

    Map<String, Route> routeTable = Map.of();
    if (source.overlayActive()) {
      try {
        routeTable = routes.bgpRoutesByDestination();
      } catch (IOException | RuntimeException ex) {
        log.error("Failed to get BGP routes", ex);
        return TickOutcome.ROUTES_ERR;
      }
    }

    TickInputs inputs = new TickInputs(solana, snapshot, source, routeTable);
    Map<ProbeTargetId, ProbeTarget> allTargets = new LinkedHashMap<>();
    List<PlannedProbe> allPlans = new ArrayList<>();
    for (ProbePlanner planner : planners) {
      PlanBatch batch;
      try {
        batch = planner.buildPlans(inputs);
      } catch (RuntimeException ex) {
        log.error("Failed to build {} plans", planner.kind(), ex);
        return TickOutcome.plansError(planner.kind());
      }
      for (Map.Entry<ProbeTargetId, ProbeTarget> entry : batch.dedup().entrySet()) {
        if (allTargets.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
          log.debug("Target {} shared with an earlier planner; {} plan reuses its result",
              entry.getKey(), planner.kind());
        }
      }
      for (ProbePlan plan : batch.plans()) {
        allPlans.add(new PlannedProbe(planner, plan));
      }
    }

    targets.update(allTargets);
    metrics.gauge(MonitorMetrics.TARGETS_CURRENT, targets.size());

    Map<ProbeTargetId, ProbeResult> results;
    try {
      results = targets.executeProbes(ctx);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while executing probes");
      return TickOutcome.PROBES_ERR;
    }

    boolean recording = sink != PointSink.NO_OP;
    ResultsSummary summary = new ResultsSummary();
    for (PlannedProbe planned : allPlans) {
      ProbePlan plan = planned.plan();
      ProbeResult result = results.get(plan.id());
      if (result == null) {
        continue;
      }
      if (result.ok()) {
        metrics.increment(MonitorMetrics.PLAN_PROBES_SUCCESS, MonitorMetrics.planLabels(plan.kind(), plan.path()));
      } else if (result.notReady()) {
        metrics.increment(MonitorMetrics.PLAN_PROBES_NOT_READY, MonitorMetrics.planLabels(plan.kind(), plan.path()));
      } else {
        metrics.increment(MonitorMetrics.PLAN_PROBES_FAIL,
            MonitorMetrics.failLabels(plan.kind(), plan.path(), result.failReason()));
      }
      if (recording) {
        planned.planner().record(inputs, plan, result).forEach(sink::write);
      }
      summary.add(plan.kind(), plan.path(), result);
    }
    if (recording) {
      sink.flush();
    }

    summary.log(Duration.between(started, clock.now()), settings.overlayConfigured());
    log.info("Tick complete targets={} threads={}", targets.size(), Thread.activeCount());
    return TickOutcome.OK;
  }

  private record PlannedProbe(ProbePlanner planner, ProbePlan plan) {}
}
