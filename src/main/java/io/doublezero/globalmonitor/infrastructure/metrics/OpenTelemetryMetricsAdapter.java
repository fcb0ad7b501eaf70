package io.doublezero.globalmonitor.infrastructure.metrics;

import io.doublezero.globalmonitor.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * {@link MetricsPort} backed by an OpenTelemetry meter. Instruments are created on first use and
 * cached by name; a disabled exporter records into the API noop meter.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Pattern ILLEGAL = Pattern.compile("[^a-z0-9_.-]");

  private final MeterProviders.MeterHandle handle;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();
  private final ConcurrentMap<Map<String, String>, Attributes> labelSets = new ConcurrentHashMap<>();

  /**
   * @param settings exporter selection; blank fields fall back to {@code otel.*} properties and {@code OTEL_*} variables
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(MeterProviders.open(Objects.requireNonNull(settings, "settings")));
  }

  OpenTelemetryMetricsAdapter(MeterProviders.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.meter = handle.meter();
  }

  @Override
  public void increment(String key, Map<String, String> labels) {
    counters.computeIfAbsent(sanitizeName(key), name -> meter.counterBuilder(name).setUnit("1").build())
        .add(1, attributes(labels));
  }

  @Override
  public void observe(String key, long value) {
    histograms.computeIfAbsent(sanitizeName(key), name -> meter.histogramBuilder(name).ofLongs().build())
        .record(value);
  }

  @Override
  public void gauge(String key, long value) {
    gauges.computeIfAbsent(sanitizeName(key), this::registerGauge).set(value);
  }

  boolean exporting() {
    return handle.exporting();
  }

  void forceFlush() {
    handle.flush();
  }

  @Override
  public void close() {
    handle.flush();
    handle.close();
  }

  private AtomicLong registerGauge(String name) {
    AtomicLong latest = new AtomicLong();
    meter.gaugeBuilder(name).ofLongs().buildWithCallback(m -> m.record(latest.get()));
    return latest;
  }

  private Attributes attributes(Map<String, String> labels) {
    if (labels == null || labels.isEmpty()) {
      return Attributes.empty();
    }
    return labelSets.computeIfAbsent(Map.copyOf(labels), copy -> {
      AttributesBuilder builder = Attributes.builder();
      copy.forEach((k, v) -> builder.put(AttributeKey.stringKey(k), v));
      return builder.build();
    });
  }

  /** Lower-cases, replaces characters OpenTelemetry rejects with {@code _}, and forces a leading letter. */
  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return "gm.metric";
    }
    String name = ILLEGAL.matcher(key.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    return Character.isLetter(name.charAt(0)) ? name : "m" + name;
  }
}
