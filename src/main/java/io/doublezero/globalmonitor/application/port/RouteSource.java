package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.domain.net.Route;
import java.io.IOException;
import java.util.Map;

/**
 * Kernel BGP routes keyed by destination. Only key presence is consulted.
 */
public interface RouteSource {
  Map<String, Route> bgpRoutesByDestination() throws IOException;
}
