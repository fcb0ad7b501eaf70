package io.doublezero.globalmonitor.config;

import io.doublezero.globalmonitor.validation.Durations;
import io.doublezero.globalmonitor.validation.Net;
import io.doublezero.globalmonitor.validation.Numbers;
import io.doublezero.globalmonitor.validation.Strings;
import java.net.InetAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable monitor configuration assembled from CLI {@code key=value} pairs and YAML sections.
 *
 * @param publicIface public interface used for public-internet probes
 * @param publicIp explicit public IPv4, {@code null} to read it from {@code publicIface}
 * @param dzIface overlay interface, {@code null} when overlay probing is off
 * @param sourceMetro metro code of this host
 * @param probeInterval time between ticks
 * @param probeTimeout per-probe deadline
 * @param keepAlivePeriod QUIC keep-alive period
 * @param maxIdleTimeout QUIC idle timeout
 * @param handshakeIdleTimeout QUIC handshake timeout
 * @param maxConcurrency maximum concurrent probe or close operations
 * @param verboseFailures log each failed probe
 * @param verboseSuccesses log each successful probe
 * @param solanaRpcUrl Solana JSON-RPC endpoint
 * @param registryFile exported DoubleZero registry document
 * @param kafkaBootstrap Kafka bootstrap servers, {@code null} disables the point sink
 * @param kafkaTopic topic receiving measurement points
 * @param metricsExporter {@code otlp} or {@code none}; empty defers to the environment
 * @param otelEndpoint OTLP endpoint; empty defers to the environment
 * @param otelResourceAttributes extra OTel resource attributes
 * @param dzStatusCommand DoubleZero client executable
 */
public record MonitorConfig(
    String publicIface,
    InetAddress publicIp,
    String dzIface,
    String sourceMetro,
    Duration probeInterval,
    Duration probeTimeout,
    Duration keepAlivePeriod,
    Duration maxIdleTimeout,
    Duration handshakeIdleTimeout,
    int maxConcurrency,
    boolean verboseFailures,
    boolean verboseSuccesses,
    String solanaRpcUrl,
    Path registryFile,
    String kafkaBootstrap,
    String kafkaTopic,
    String metricsExporter,
    String otelEndpoint,
    String otelResourceAttributes,
    String dzStatusCommand) {

  public static final Duration DEFAULT_PROBE_INTERVAL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(8);
  public static final Duration DEFAULT_KEEP_ALIVE_PERIOD = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_IDLE_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_HANDSHAKE_IDLE_TIMEOUT = Duration.ofSeconds(2);
  public static final int DEFAULT_MAX_CONCURRENCY = 128;
  public static final String DEFAULT_SOLANA_RPC_URL = "https://api.mainnet-beta.solana.com";
  public static final String DEFAULT_KAFKA_TOPIC = "gm.measurements";
  public static final String DEFAULT_DZ_STATUS_COMMAND = "doublezero";
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  /** Setting names accepted by {@link #fromMap(Map)}. */
  public static final Set<String> KEYS = Set.of(
      "publicIface", "publicIp", "dzIface", "sourceMetro",
      "probeInterval", "probeTimeout", "keepAlivePeriod", "maxIdleTimeout", "handshakeIdleTimeout",
      "maxConcurrency", "verboseFailures", "verboseSuccesses",
      "solanaRpcUrl", "registryFile", "kafkaBootstrap", "kafkaTopic",
      "metricsExporter", "otelEndpoint", "otelResourceAttributes", "dzStatusCommand");

  public MonitorConfig {
    Objects.requireNonNull(publicIface, "publicIface");
    Objects.requireNonNull(sourceMetro, "sourceMetro");
    Objects.requireNonNull(probeInterval, "probeInterval");
    Objects.requireNonNull(probeTimeout, "probeTimeout");
    Objects.requireNonNull(keepAlivePeriod, "keepAlivePeriod");
    Objects.requireNonNull(maxIdleTimeout, "maxIdleTimeout");
    Objects.requireNonNull(handshakeIdleTimeout, "handshakeIdleTimeout");
    Objects.requireNonNull(solanaRpcUrl, "solanaRpcUrl");
    Objects.requireNonNull(registryFile, "registryFile");
    if (maxConcurrency <= 0) {
      throw new IllegalArgumentException("maxConcurrency must be greater than 0");
    }
    if (dzIface != null && dzIface.equals(publicIface)) {
      throw new IllegalArgumentException("dzIface must differ from publicIface");
    }
    kafkaTopic = kafkaTopic == null ? DEFAULT_KAFKA_TOPIC : kafkaTopic;
    metricsExporter = metricsExporter == null ? "" : metricsExporter;
    otelEndpoint = otelEndpoint == null ? "" : otelEndpoint;
    otelResourceAttributes = otelResourceAttributes == null ? "" : otelResourceAttributes;
    dzStatusCommand = dzStatusCommand == null ? DEFAULT_DZ_STATUS_COMMAND : dzStatusCommand;
  }

  /**
   * Builds a configuration from flat key/value input, applying defaults for missing optional keys.
   *
   * @param input merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static MonitorConfig fromMap(Map<String, String> input) {
    Map<String, String> kv = input == null ? Map.of() : input;

    String publicIface = Strings.requireInterfaceName("publicIface", required(kv, "publicIface"));
    InetAddress publicIp = optional(kv, "publicIp") == null ? null : Net.requireIpv4(kv.get("publicIp"));
    String dzIface = optional(kv, "dzIface") == null
        ? null
        : Strings.requireInterfaceName("dzIface", kv.get("dzIface"));
    String metro = Strings.requireNonBlank("sourceMetro", required(kv, "sourceMetro")).toLowerCase(Locale.ROOT);

    Duration probeInterval = duration(kv, "probeInterval", DEFAULT_PROBE_INTERVAL);
    Duration probeTimeout = duration(kv, "probeTimeout", DEFAULT_PROBE_TIMEOUT);
    Duration keepAlive = duration(kv, "keepAlivePeriod", DEFAULT_KEEP_ALIVE_PERIOD);
    Duration maxIdle = duration(kv, "maxIdleTimeout", DEFAULT_MAX_IDLE_TIMEOUT);
    Duration handshake = duration(kv, "handshakeIdleTimeout", DEFAULT_HANDSHAKE_IDLE_TIMEOUT);
    int maxConcurrency = optional(kv, "maxConcurrency") == null
        ? DEFAULT_MAX_CONCURRENCY
        : Numbers.parseInt("maxConcurrency", kv.get("maxConcurrency"), 1, 4096);

    String rpcUrl = optional(kv, "solanaRpcUrl") == null
        ? DEFAULT_SOLANA_RPC_URL
        : Net.validateHttpUri("solanaRpcUrl", kv.get("solanaRpcUrl")).toString();
    Path registryFile = Path.of(Strings.requireNonBlank("registryFile", required(kv, "registryFile")));

    String kafkaBootstrap = optional(kv, "kafkaBootstrap") == null
        ? null
        : Net.validateHostPortList(kv.get("kafkaBootstrap"));
    String kafkaTopic = optional(kv, "kafkaTopic") == null
        ? DEFAULT_KAFKA_TOPIC
        : Strings.requireKafkaTopic("kafkaTopic", kv.get("kafkaTopic"));

    String exporter = optional(kv, "metricsExporter");
    if (exporter != null) {
      exporter = exporter.toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
    }
    String endpoint = optional(kv, "otelEndpoint") == null
        ? null
        : Net.validateHttpUri("otelEndpoint", kv.get("otelEndpoint")).toString();
    String resourceAttrs = optional(kv, "otelResourceAttributes") == null
        ? null
        : Strings.requirePrintableAscii("otelResourceAttributes", kv.get("otelResourceAttributes"),
            MAX_RESOURCE_ATTRIBUTES_LENGTH);
    String statusCommand = optional(kv, "dzStatusCommand") == null
        ? DEFAULT_DZ_STATUS_COMMAND
        : Strings.requirePrintableAscii("dzStatusCommand", kv.get("dzStatusCommand"), 1024);

    return new MonitorConfig(
        publicIface,
        publicIp,
        dzIface,
        metro,
        probeInterval,
        probeTimeout,
        keepAlive,
        maxIdle,
        handshake,
        maxConcurrency,
        bool(kv, "verboseFailures"),
        bool(kv, "verboseSuccesses"),
        rpcUrl,
        registryFile,
        kafkaBootstrap,
        kafkaTopic,
        exporter,
        endpoint,
        resourceAttrs,
        statusCommand);
  }

  private static String required(Map<String, String> kv, String key) {
    String value = optional(kv, key);
    if (value == null) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static String optional(Map<String, String> kv, String key) {
    String value = kv.get(key);
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  private static Duration duration(Map<String, String> kv, String key, Duration fallback) {
    String value = optional(kv, key);
    return value == null ? fallback : Durations.parsePositive(key, value);
  }

  private static boolean bool(Map<String, String> kv, String key) {
    String value = optional(kv, key);
    return value != null && Boolean.parseBoolean(value);
  }
}
