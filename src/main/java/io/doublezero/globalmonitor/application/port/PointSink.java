package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.domain.probe.MeasurementPoint;

/**
 * <strong>What:</strong> Destination for tagged measurement points.
 * <p><strong>Role:</strong> Output port implemented by {@code KafkaPointSinkAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Called from the tick thread only.</p>
 */
public interface PointSink extends AutoCloseable {
  void write(MeasurementPoint point);

  default void flush() {}

  @Override
  default void close() {}

  /** Sink that discards every point. */
  PointSink NO_OP = point -> {};
}
