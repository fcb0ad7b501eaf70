package io.doublezero.globalmonitor.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter the monitor records into: an OTLP-exporting SDK provider, or the API noop meter.
 */
final class MeterProviders {
  private static final Logger log = LoggerFactory.getLogger(MeterProviders.class);
  static final String SCOPE = "io.doublezero.globalmonitor";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private MeterProviders() {
    // Utility
  }

  static MeterHandle open(MetricsSettings settings) {
    MetricsSettings resolved = settings.resolve();
    if (!resolved.enabled()) {
      log.info("Metrics export disabled (exporter=none)");
      return MeterHandle.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(resolved.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      MeterHandle handle = withReader(reader, parseResourceAttributes(resolved.resourceAttributes()));
      log.info("Exporting metrics over OTLP to {} every {}s", resolved.endpoint(), EXPORT_INTERVAL.toSeconds());
      return handle;
    } catch (RuntimeException ex) {
      log.error("Could not start the OTLP metrics exporter; metrics are dropped", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle withReader(MetricReader reader, Attributes extraResource) {
    Objects.requireNonNull(reader, "reader");
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(extraResource))
        .registerMetricReader(reader)
        .build();
    return new MeterHandle(provider.meterBuilder(SCOPE).setInstrumentationVersion(version()).build(), provider);
  }

  static Resource resource(Attributes extra) {
    AttributesBuilder service = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "global-monitor")
        .put(AttributeKey.stringKey("service.namespace"), "io.doublezero")
        .put(AttributeKey.stringKey("service.version"), version())
        .put(AttributeKey.stringKey("service.instance.id"), hostname());
    return Resource.getDefault().merge(Resource.create(service.build())).merge(Resource.create(extra));
  }

  /** Parses {@code k=v,k2=v2}; entries without both a key and a value are logged and skipped. */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      if (entry.isBlank()) {
        continue;
      }
      String[] pair = entry.split("=", 2);
      String key = pair[0].trim();
      String value = pair.length == 2 ? pair[1].trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Skipping resource attribute '{}'", entry.trim());
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String version() {
    String version = MeterProviders.class.getPackage().getImplementationVersion();
    return version == null ? "dev" : version;
  }

  private static String hostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      String env = System.getenv("HOSTNAME");
      return env == null || env.isBlank() ? "unknown" : env;
    }
  }

  /** Meter plus the SDK provider behind it; {@code provider} is null for the noop meter. */
  record MeterHandle(Meter meter, SdkMeterProvider provider) implements AutoCloseable {
    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(SCOPE), null);
    }

    boolean exporting() {
      return provider != null;
    }

    void flush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String what) {
      if (!result.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("Meter provider {} did not complete within {}s", what, SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
