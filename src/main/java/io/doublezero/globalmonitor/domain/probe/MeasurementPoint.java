package io.doublezero.globalmonitor.domain.probe;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tagged measurement written to the point sink.
 *
 * @param table destination table
 * @param tags string tags
 * @param fields typed fields (numbers, booleans, strings)
 * @param timestamp measurement time
 */
public record MeasurementPoint(
    String table, Map<String, String> tags, Map<String, Object> fields, Instant timestamp) {
  public MeasurementPoint {
    Objects.requireNonNull(table, "table");
    tags = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(tags, "tags")));
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
  }

  public String tag(String key) {
    return tags.get(key);
  }

  public Object field(String key) {
    return fields.get(key);
  }
}
