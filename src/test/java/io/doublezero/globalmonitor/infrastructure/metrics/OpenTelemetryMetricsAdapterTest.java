package io.doublezero.globalmonitor.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(MeterProviders.withReader(reader, Attributes.empty()));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void countersKeepOneSeriesPerLabelSet() {
    adapter.increment("gm.tick.total", Map.of("outcome", "ok"));
    adapter.increment("gm.tick.total", Map.of("outcome", "ok"));
    adapter.increment("gm.tick.total", Map.of("outcome", "solana_err"));
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "gm.tick.total").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    assertEquals(2, counter.getLongSumData().getPoints().size());

    AttributeKey<String> outcome = AttributeKey.stringKey("outcome");
    long ok = counter.getLongSumData().getPoints().stream()
        .filter(p -> "ok".equals(p.getAttributes().get(outcome)))
        .mapToLong(LongPointData::getValue)
        .sum();
    assertEquals(2L, ok);

    AttributeKey<String> serviceName = AttributeKey.stringKey("service.name");
    assertEquals("global-monitor", counter.getResource().getAttribute(serviceName));
    AttributeKey<String> serviceNamespace = AttributeKey.stringKey("service.namespace");
    assertEquals("io.doublezero", counter.getResource().getAttribute(serviceNamespace));
  }

  @Test
  void observationsLandInHistogram() {
    adapter.observe("gm.tick.duration.ms", 120);
    adapter.observe("gm.tick.duration.ms", 80);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "gm.tick.duration.ms").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum(), 0.0001);
  }

  @Test
  void gaugeReportsLatestValue() {
    adapter.gauge("gm.targets.current", 10);
    adapter.gauge("gm.targets.current", 42);
    adapter.forceFlush();

    MetricData gauge = find(reader.collectAllMetrics(), "gm.targets.current").orElseThrow();
    assertEquals(MetricDataType.LONG_GAUGE, gauge.getType());
    assertEquals(42L, gauge.getLongGaugeData().getPoints().iterator().next().getValue());
  }

  @Test
  void sanitizeNameReplacesIllegalCharacters() {
    assertEquals("gm.probe_fail", OpenTelemetryMetricsAdapter.sanitizeName("GM.probe fail"));
    assertEquals("m1st", OpenTelemetryMetricsAdapter.sanitizeName("1st"));
    assertEquals("gm.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    var attrs = MeterProviders.parseResourceAttributes("deployment.environment=prod, broken,=x,host.name=gm-1");

    assertEquals(2, attrs.size());
    assertEquals("prod", attrs.get(AttributeKey.stringKey("deployment.environment")));
    assertTrue(MeterProviders.parseResourceAttributes(" ").isEmpty());
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
