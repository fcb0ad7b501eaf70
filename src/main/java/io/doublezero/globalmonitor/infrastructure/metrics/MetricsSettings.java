package io.doublezero.globalmonitor.infrastructure.metrics;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Metrics exporter selection.
 *
 * @param exporter {@code otlp} or {@code none}; blank falls back to system properties, then the environment
 * @param endpoint OTLP gRPC endpoint; blank falls back the same way
 * @param resourceAttributes extra {@code key=value,...} resource attributes
 */
public record MetricsSettings(String exporter, String endpoint, String resourceAttributes) {
  static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public MetricsSettings {
    exporter = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null ? "" : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /** Fills blank fields from the JVM system properties and {@code OTEL_*} environment variables. */
  MetricsSettings resolve() {
    return resolve(System::getProperty, System::getenv);
  }

  MetricsSettings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
    String resolvedExporter = pick(exporter,
        properties.apply("otel.metrics.exporter"), environment.apply("OTEL_METRICS_EXPORTER"));
    String resolvedEndpoint = pick(endpoint,
        properties.apply("otel.exporter.otlp.endpoint"), environment.apply("OTEL_EXPORTER_OTLP_ENDPOINT"));
    String resolvedAttributes = pick(resourceAttributes,
        properties.apply("otel.resource.attributes"), environment.apply("OTEL_RESOURCE_ATTRIBUTES"));
    return new MetricsSettings(
        resolvedExporter.isEmpty() ? "otlp" : resolvedExporter,
        resolvedEndpoint.isEmpty() ? DEFAULT_ENDPOINT : resolvedEndpoint,
        resolvedAttributes);
  }

  /** Anything other than {@code none} exports over OTLP. */
  boolean enabled() {
    return !"none".equals(exporter);
  }

  private static String pick(String explicit, String property, String env) {
    if (!explicit.isBlank()) {
      return explicit;
    }
    if (property != null && !property.isBlank()) {
      return property.trim();
    }
    return env == null ? "" : env.trim();
  }
}
