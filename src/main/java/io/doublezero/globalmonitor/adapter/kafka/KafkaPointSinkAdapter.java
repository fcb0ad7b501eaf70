package io.doublezero.globalmonitor.adapter.kafka;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.doublezero.globalmonitor.application.port.PointSink;
import io.doublezero.globalmonitor.domain.probe.MeasurementPoint;
import io.doublezero.globalmonitor.validation.Strings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka-backed {@link PointSink} that streams measurement points as JSON.
 * <p><strong>Why:</strong> Hands probe measurements to a time-series loader running elsewhere.</p>
 * <p><strong>Role:</strong> Adapter on the sink side of the tick pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serialize points as {@code {"table":..,"ts":..,"tags":{..},"fields":{..}}}.</li>
 *   <li>Key records by table so each table stays ordered within a partition.</li>
 *   <li>Flush once per tick and close the producer on shutdown.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mirrors the provided {@link Producer}; the default {@link KafkaProducer} is thread-safe.</p>
 */
public final class KafkaPointSinkAdapter implements PointSink {
  private static final Logger log = LoggerFactory.getLogger(KafkaPointSinkAdapter.class);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a Kafka sink for measurement points.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers; must not be blank
   * @param topic topic that receives serialized points; must not be blank
   * @throws IllegalArgumentException if any parameter is blank
   */
  public KafkaPointSinkAdapter(String bootstrapServers, String topic) {
    this(createProducer(bootstrapServers), topic);
  }

  KafkaPointSinkAdapter(Producer<String, byte[]> producer, String topic) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.requireKafkaTopic("topic", topic);
  }

  /**
   * Publishes the point; {@code null} inputs are ignored.
   */
  @Override
  public void write(MeasurementPoint point) {
    if (point == null) {
      return;
    }
    ProducerRecord<String, byte[]> message =
        new ProducerRecord<>(topic, point.table(), serialize(point));
    producer.send(message, (metadata, ex) -> {
      if (ex != null) {
        log.error("Kafka publish failure for table {} on topic {}", point.table(), topic, ex);
      }
    });
  }

  @Override
  public void flush() {
    producer.flush();
  }

  /**
   * Flushes pending messages and closes the producer, waiting up to five seconds.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  byte[] serialize(MeasurementPoint point) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(512);
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("table", point.table());
      if (point.timestamp() != null) {
        gen.writeStringField("ts", point.timestamp().toString());
      }
      gen.writeObjectFieldStart("tags");
      for (Map.Entry<String, String> tag : point.tags().entrySet()) {
        gen.writeStringField(tag.getKey(), tag.getValue());
      }
      gen.writeEndObject();
      gen.writeObjectFieldStart("fields");
      for (Map.Entry<String, Object> field : point.fields().entrySet()) {
        writeField(gen, field.getKey(), field.getValue());
      }
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to serialize measurement point for " + point.table(), ex);
    }
    return out.toByteArray();
  }

  private static void writeField(JsonGenerator gen, String name, Object value) throws IOException {
    if (value == null) {
      gen.writeNullField(name);
    } else if (value instanceof Boolean b) {
      gen.writeBooleanField(name, b);
    } else if (value instanceof Integer i) {
      gen.writeNumberField(name, i);
    } else if (value instanceof Long l) {
      gen.writeNumberField(name, l);
    } else if (value instanceof Double d) {
      gen.writeNumberField(name, d);
    } else if (value instanceof Float f) {
      gen.writeNumberField(name, f);
    } else {
      gen.writeStringField(name, value.toString());
    }
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, Strings.requireNonBlank("bootstrapServers", bootstrapServers));
    props.put(ProducerConfig.CLIENT_ID_CONFIG, "global-monitor");
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 50);
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 30_000);
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 10_000);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
