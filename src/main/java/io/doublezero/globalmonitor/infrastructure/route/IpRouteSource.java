package io.doublezero.globalmonitor.infrastructure.route;

import io.doublezero.globalmonitor.application.port.MonitorDataException;
import io.doublezero.globalmonitor.application.port.RouteSource;
import io.doublezero.globalmonitor.domain.net.Route;
import io.doublezero.globalmonitor.infrastructure.exec.CommandRunner;
import io.doublezero.globalmonitor.infrastructure.json.JsonTree;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads BGP-learned IPv4 routes from the kernel through {@code ip -j}.
 */
public final class IpRouteSource implements RouteSource {
  static final List<String> COMMAND = List.of("ip", "-j", "-4", "route", "show", "table", "all", "proto", "bgp");
  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private final CommandRunner runner;

  public IpRouteSource(CommandRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public Map<String, Route> bgpRoutesByDestination() throws IOException {
    String output = runner.run(COMMAND, TIMEOUT);
    return parse(output);
  }

  /**
   * Indexes {@code ip -j route} output by destination address, dropping any prefix length.
   */
  static Map<String, Route> parse(String json) throws MonitorDataException {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    Object root;
    try {
      root = JsonTree.parse(json);
    } catch (IOException ex) {
      throw new MonitorDataException("Malformed ip route output", ex);
    }
    if (!(root instanceof List<?>)) {
      throw new MonitorDataException("ip route output is not a JSON array");
    }
    Map<String, Route> routes = new HashMap<>();
    for (Object node : JsonTree.asArray(root)) {
      Map<String, Object> entry = JsonTree.asObject(node);
      String dst = JsonTree.string(entry, "dst");
      if (dst == null || dst.isBlank() || "default".equals(dst)) {
        continue;
      }
      int slash = dst.indexOf('/');
      String destination = slash > 0 ? dst.substring(0, slash) : dst;
      routes.put(destination, new Route(destination, JsonTree.string(entry, "dev"), JsonTree.string(entry, "protocol")));
    }
    return routes;
  }
}
