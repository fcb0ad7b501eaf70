package io.doublezero.globalmonitor.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.doublezero.globalmonitor.domain.probe.MeasurementPoint;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

class KafkaPointSinkAdapterTest {

  @Test
  void publishesPointKeyedByTable() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaPointSinkAdapter adapter = new KafkaPointSinkAdapter(producer, "gm.measurements");

    adapter.write(point());
    adapter.flush();

    assertEquals(1, producer.history().size());
    var sent = producer.history().get(0);
    assertEquals("gm.measurements", sent.topic());
    assertEquals("solana_validator_icmp_probe", sent.key());
    String payload = new String(sent.value(), StandardCharsets.UTF_8);
    assertTrue(payload.contains("\"table\":\"solana_validator_icmp_probe\""));
    assertTrue(payload.contains("\"ts\":\"2026-03-01T12:00:00Z\""));
    assertTrue(payload.contains("\"tags\":{\"probe_type\":\"icmp\",\"validator_pubkey\":\"ValB\"}"));
    assertTrue(payload.contains("\"probe_ok\":true"));
    assertTrue(payload.contains("\"probe_rtt_avg_ms\":12.5"));
    assertTrue(payload.contains("\"probe_packets_sent\":3"));
  }

  @Test
  void sendFailureDoesNotPropagate() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
    KafkaPointSinkAdapter adapter = new KafkaPointSinkAdapter(producer, "gm.measurements");

    adapter.write(point());
    producer.errorNext(new RuntimeException("broker unavailable"));

    assertEquals(1, producer.history().size());
  }

  @Test
  void closeClosesProducer() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
    KafkaPointSinkAdapter adapter = new KafkaPointSinkAdapter(producer, "gm.measurements");

    adapter.close();

    assertTrue(producer.closed());
  }

  @Test
  void rejectsBlankTopic() {
    MockProducer<String, byte[]> producer =
        new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());

    assertThrows(IllegalArgumentException.class, () -> new KafkaPointSinkAdapter(producer, " "));
  }

  private static MeasurementPoint point() {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("probe_type", "icmp");
    tags.put("validator_pubkey", "ValB");
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("probe_ok", true);
    fields.put("probe_rtt_avg_ms", 12.5);
    fields.put("probe_packets_sent", 3L);
    return new MeasurementPoint(
        "solana_validator_icmp_probe", tags, fields, Instant.parse("2026-03-01T12:00:00Z"));
  }
}
