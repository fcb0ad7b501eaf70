package io.doublezero.globalmonitor.application.port;

import java.util.Map;

/**
 * <strong>What:</strong> Domain port abstracting monitor metrics emission.
 * <p><strong>Why:</strong> Lets the runner and target registry count outcomes without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Counter increments, optionally labeled (tick outcome, probe outcome per kind and path).</li>
 *   <li>Histogram observations such as tick duration.</li>
 *   <li>Gauges such as the live target count.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from probe workers.</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name such as {@code gm.targets.pruned.total}
   */
  default void increment(String key) {
    increment(key, Map.of());
  }

  /**
   * Increments the named counter by one with the given label set.
   *
   * @param key dotted metric name
   * @param labels label names and values; must not be {@code null}
   */
  void increment(String key, Map<String, String> labels);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name
   * @param value observed value; unit defined by the caller
   */
  void observe(String key, long value);

  /**
   * Sets the current value of a gauge.
   *
   * @param key dotted metric name
   * @param value latest value
   */
  void gauge(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key, Map<String, String> labels) {}

    @Override public void observe(String key, long value) {}

    @Override public void gauge(String key, long value) {}
  };
}
