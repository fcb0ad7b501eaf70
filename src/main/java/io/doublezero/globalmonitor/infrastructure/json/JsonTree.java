package io.doublezero.globalmonitor.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import io.doublezero.globalmonitor.application.port.MonitorDataException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streams JSON documents into plain {@link Map}/{@link List} graphs and offers typed accessors.
 */
public final class JsonTree {
  private static final JsonFactory FACTORY = new JsonFactory();

  private JsonTree() {
    // Utility
  }

  /**
   * Parses a JSON document.
   *
   * @throws MonitorDataException when the payload is not valid JSON
   */
  public static Object parse(String json) throws IOException {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = FACTORY.createParser(json)) {
      return parseDocument(parser);
    } catch (JsonProcessingException ex) {
      throw new MonitorDataException("Invalid JSON payload", ex);
    }
  }

  /**
   * Parses a JSON document from a stream; the stream is not closed.
   *
   * @throws MonitorDataException when the payload is not valid JSON
   * @throws IOException when reading fails
   */
  public static Object parse(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    try (JsonParser parser = FACTORY.createParser(in)) {
      return parseDocument(parser);
    } catch (JsonProcessingException ex) {
      throw new MonitorDataException("Invalid JSON payload", ex);
    }
  }

  private static Object parseDocument(JsonParser parser) throws IOException {
    JsonToken token = parser.nextToken();
    if (token == null) {
      return Map.of();
    }
    Object value = readValue(parser, token);
    if (parser.nextToken() != null) {
      throw new MonitorDataException("JSON document contains trailing content");
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object node) {
    return node instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
  }

  @SuppressWarnings("unchecked")
  public static List<Object> asArray(Object node) {
    return node instanceof List<?> list ? (List<Object>) list : List.of();
  }

  public static String string(Map<String, Object> object, String key) {
    Object value = object.get(key);
    return value == null ? null : value.toString();
  }

  public static long number(Map<String, Object> object, String key, long fallback) {
    Object value = object.get(key);
    if (value instanceof Number n) {
      return n.longValue();
    }
    if (value instanceof String s) {
      try {
        return Long.parseLong(s.trim());
      } catch (NumberFormatException ex) {
        return fallback;
      }
    }
    return fallback;
  }

  public static boolean bool(Map<String, Object> object, String key) {
    Object value = object.get(key);
    if (value instanceof Boolean b) {
      return b;
    }
    return value instanceof String s && Boolean.parseBoolean(s.trim());
  }

  private static Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new MonitorDataException("Unsupported JSON token: " + token);
    };
  }

  private static Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        return map;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new MonitorDataException("Expected field name but found " + token);
      }
      String name = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      if (valueToken == null) {
        throw new MonitorDataException("Unexpected end of JSON object");
      }
      map.put(name, readValue(parser, valueToken));
    }
  }

  private static List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        return list;
      }
      if (token == null) {
        throw new MonitorDataException("Unexpected end of JSON array");
      }
      list.add(readValue(parser, token));
    }
  }
}
