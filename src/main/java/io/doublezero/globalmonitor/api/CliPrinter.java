package io.doublezero.globalmonitor.api;

import io.doublezero.globalmonitor.config.MonitorConfig;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console text of the monitor CLI: usage, help and the dry-run plan. Written to stdout, separate
 * from the log stream.
 */
final class CliPrinter {
  static final String USAGE =
      "usage: global-monitor publicIface=<nic> sourceMetro=<code> registryFile=PATH [options]";
  private static final String HELP = """
      DoubleZero global monitor

      Usage:
        global-monitor publicIface=<nic> sourceMetro=<code> registryFile=PATH [options]

      Required:
        publicIface=NAME            Public internet interface
        sourceMetro=CODE            Metro code of this host
        registryFile=PATH           Exported DoubleZero registry document (JSON)

      Optional:
        config=PATH                 YAML file; 'common' and 'monitor' sections apply under CLI values
        publicIp=IPv4               Public address (default: first IPv4 on publicIface)
        dzIface=NAME                DoubleZero interface; enables overlay probing
        probeInterval=DURATION      Time between ticks (default 60s)
        probeTimeout=DURATION       Per-probe deadline (default 8s)
        keepAlivePeriod=DURATION    QUIC keep-alive period (default 1s)
        maxIdleTimeout=DURATION     QUIC idle timeout (default 5s)
        handshakeIdleTimeout=DURATION  QUIC handshake timeout (default 2s)
        maxConcurrency=1-4096       Concurrent probes (default 128)
        verboseFailures=true|false  Log every failed probe at DEBUG
        verboseSuccesses=true|false Log every successful probe at DEBUG
        solanaRpcUrl=URL            Solana JSON-RPC endpoint (default mainnet-beta)
        kafkaBootstrap=HOST:PORT    Publish measurements to Kafka
        kafkaTopic=TOPIC            Measurement topic (default gm.measurements)
        dzStatusCommand=PATH        DoubleZero client executable (default doublezero)
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate configuration and print it without probing
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Durations accept 500ms, 8s, 1m or ISO-8601 (PT8S).""";

  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  static void usage() {
    out().println(USAGE);
  }

  static void help() {
    out().println(HELP);
  }

  static void dryRun(MonitorConfig config) {
    PrintWriter out = out();
    out.println("Monitor dry-run: no probes will be sent.");
    row(out, "Public iface", config.publicIface());
    row(out, "Public IP", config.publicIp() == null ? "<from interface>" : config.publicIp().getHostAddress());
    row(out, "DZ iface", config.dzIface() == null ? "<none>" : config.dzIface());
    row(out, "Source metro", config.sourceMetro());
    row(out, "Probe interval", config.probeInterval());
    row(out, "Probe timeout", config.probeTimeout());
    row(out, "Max concurrency", config.maxConcurrency());
    row(out, "Solana RPC", config.solanaRpcUrl());
    row(out, "Registry file", config.registryFile());
    row(out, "Kafka bootstrap", config.kafkaBootstrap() == null ? "<none>" : config.kafkaBootstrap());
    row(out, "Kafka topic", config.kafkaTopic());
    out.println(" Re-run without --dry-run to start probing.");
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static void row(PrintWriter out, String label, Object value) {
    out.printf(" %-17s: %s%n", label, value);
  }

  private static PrintWriter out() {
    PrintWriter writer = override;
    return writer != null ? writer : STDOUT;
  }
}
