package io.doublezero.globalmonitor.config;

import io.doublezero.globalmonitor.adapter.kafka.KafkaPointSinkAdapter;
import io.doublezero.globalmonitor.application.pipeline.ProbeRunner;
import io.doublezero.globalmonitor.application.pipeline.RunnerSettings;
import io.doublezero.globalmonitor.application.plan.ProbePlanner;
import io.doublezero.globalmonitor.application.plan.UserIcmpPlanner;
import io.doublezero.globalmonitor.application.plan.ValidatorIcmpPlanner;
import io.doublezero.globalmonitor.application.plan.ValidatorTpuQuicPlanner;
import io.doublezero.globalmonitor.application.port.ClockPort;
import io.doublezero.globalmonitor.application.port.GeoIpResolver;
import io.doublezero.globalmonitor.application.port.InterfaceAddresses;
import io.doublezero.globalmonitor.application.port.MetricsPort;
import io.doublezero.globalmonitor.application.port.OverlayStatusSource;
import io.doublezero.globalmonitor.application.port.PointSink;
import io.doublezero.globalmonitor.application.port.ProbeTargetFactory;
import io.doublezero.globalmonitor.application.probe.TargetSet;
import io.doublezero.globalmonitor.application.probe.TargetSetSettings;
import io.doublezero.globalmonitor.application.source.SourceResolver;
import io.doublezero.globalmonitor.application.source.SourceSettings;
import io.doublezero.globalmonitor.infrastructure.DefaultProbeTargetFactory;
import io.doublezero.globalmonitor.infrastructure.exec.CommandRunner;
import io.doublezero.globalmonitor.infrastructure.exec.ProcessCommandRunner;
import io.doublezero.globalmonitor.infrastructure.icmp.IcmpSettings;
import io.doublezero.globalmonitor.infrastructure.icmp.PingCommandPinger;
import io.doublezero.globalmonitor.infrastructure.metrics.MetricsSettings;
import io.doublezero.globalmonitor.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.doublezero.globalmonitor.infrastructure.net.NetworkInterfaceAddresses;
import io.doublezero.globalmonitor.infrastructure.quic.NettyQuicDialer;
import io.doublezero.globalmonitor.infrastructure.quic.QuicDialConfig;
import io.doublezero.globalmonitor.infrastructure.registry.JsonFileRegistrySource;
import io.doublezero.globalmonitor.infrastructure.route.IpRouteSource;
import io.doublezero.globalmonitor.infrastructure.solana.SolanaRpcValidatorSource;
import io.doublezero.globalmonitor.infrastructure.status.DoubleZeroStatusCommand;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the probe runner to its concrete adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build metrics, sink, dialer, planners and the target registry from {@link MonitorConfig}.</li>
 *   <li>Close owned resources in reverse creation order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Built and closed on the CLI thread.</p>
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  private static final int QUIC_EVENT_LOOP_THREADS = 2;

  private final MonitorConfig config;
  private final Deque<AutoCloseable> owned = new ArrayDeque<>();
  private final ClockPort clock = ClockPort.SYSTEM;
  private final InterfaceAddresses interfaces = new NetworkInterfaceAddresses();
  private final CommandRunner commands = new ProcessCommandRunner();
  private final GeoIpResolver geoIp = GeoIpResolver.NONE;
  private MetricsPort metrics;

  public CompositionRoot(MonitorConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  public MonitorConfig config() {
    return config;
  }

  /** Metrics adapter, created on first use. */
  public MetricsPort metrics() {
    if (metrics == null) {
      OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(new MetricsSettings(
          config.metricsExporter(), config.otelEndpoint(), config.otelResourceAttributes()));
      owned.push(adapter);
      metrics = adapter;
    }
    return metrics;
  }

  /**
   * Builds a fully wired runner. Resources it owns are released by {@link #close()}.
   */
  public ProbeRunner probeRunner() {
    MetricsPort metricsPort = metrics();

    PointSink sink = PointSink.NO_OP;
    if (config.kafkaBootstrap() != null) {
      KafkaPointSinkAdapter kafka = new KafkaPointSinkAdapter(config.kafkaBootstrap(), config.kafkaTopic());
      owned.push(kafka);
      sink = kafka;
      log.info("Publishing measurements to Kafka topic {}", config.kafkaTopic());
    }

    NettyQuicDialer dialer = new NettyQuicDialer(interfaces, metricsPort, QUIC_EVENT_LOOP_THREADS);
    owned.push(dialer);
    QuicDialConfig dialConfig = new QuicDialConfig(
        config.maxIdleTimeout(), config.handshakeIdleTimeout(), config.keepAlivePeriod(),
        QuicDialConfig.SOLANA_TPU_ALPN);
    ProbeTargetFactory targets =
        new DefaultProbeTargetFactory(new PingCommandPinger(commands), IcmpSettings.defaults(), dialer, dialConfig);

    List<ProbePlanner> planners = List.of(
        new ValidatorIcmpPlanner(targets),
        new ValidatorTpuQuicPlanner(targets),
        new UserIcmpPlanner(targets, geoIp));

    TargetSet targetSet = new TargetSet(
        new TargetSetSettings(
            config.probeTimeout(), config.maxConcurrency(), config.verboseFailures(), config.verboseSuccesses()),
        clock,
        metricsPort);
    owned.push(targetSet);

    OverlayStatusSource status = config.dzIface() == null
        ? OverlayStatusSource.ALWAYS_CONNECTED
        : new DoubleZeroStatusCommand(commands, config.dzStatusCommand());
    SourceResolver sourceResolver = new SourceResolver(
        new SourceSettings(config.publicIface(), config.publicIp(), config.dzIface(), config.sourceMetro()),
        interfaces,
        status,
        CompositionRoot::hostname);

    return new ProbeRunner(
        new RunnerSettings(config.probeInterval(), config.dzIface() != null),
        new SolanaRpcValidatorSource(config.solanaRpcUrl(), geoIp),
        new JsonFileRegistrySource(config.registryFile()),
        sourceResolver,
        new IpRouteSource(commands),
        planners,
        targetSet,
        sink,
        metricsPort,
        clock);
  }

  @Override
  public void close() {
    while (!owned.isEmpty()) {
      AutoCloseable resource = owned.pop();
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource.getClass().getSimpleName(), ex);
      }
    }
  }

  private static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Unable to resolve local host name", ex);
      return "";
    }
  }
}
