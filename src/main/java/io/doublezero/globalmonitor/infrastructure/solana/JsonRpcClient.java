package io.doublezero.globalmonitor.infrastructure.solana;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.doublezero.globalmonitor.application.port.MonitorDataException;
import io.doublezero.globalmonitor.infrastructure.json.JsonTree;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.StringWriter;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal JSON-RPC 2.0 client over {@link HttpClient}.
 */
class JsonRpcClient {
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final JsonFactory JSON = new JsonFactory();

  private final HttpClient http;
  private final URI endpoint;
  private final AtomicLong ids = new AtomicLong();

  JsonRpcClient(HttpClient http, URI endpoint) {
    this.http = Objects.requireNonNull(http, "http");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
  }

  /**
   * Calls a parameterless method and returns its {@code result} member.
   *
   * @throws IOException on transport failure, non-2xx status, RPC error or malformed payload
   */
  Object call(String method) throws IOException {
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .timeout(REQUEST_TIMEOUT)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody(method)))
        .build();
    HttpResponse<String> response;
    try {
      response = http.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted calling " + method);
    }
    if (response.statusCode() / 100 != 2) {
      throw new IOException(method + " returned HTTP " + response.statusCode());
    }
    Map<String, Object> body;
    try {
      body = JsonTree.asObject(JsonTree.parse(response.body()));
    } catch (IOException ex) {
      throw new MonitorDataException("Malformed " + method + " response", ex);
    }
    Object error = body.get("error");
    if (error != null) {
      Map<String, Object> err = JsonTree.asObject(error);
      throw new IOException(method + " failed: " + JsonTree.number(err, "code", 0) + " "
          + JsonTree.string(err, "message"));
    }
    if (!body.containsKey("result")) {
      throw new MonitorDataException(method + " response has no result");
    }
    return body.get("result");
  }

  private String requestBody(String method) throws IOException {
    StringWriter out = new StringWriter(96);
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("jsonrpc", "2.0");
      gen.writeNumberField("id", ids.incrementAndGet());
      gen.writeStringField("method", method);
      gen.writeEndObject();
    }
    return out.toString();
  }
}
