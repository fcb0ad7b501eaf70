package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.domain.net.GeoIpRecord;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Resolves GeoIP annotations. Absence only reduces tag richness.
 */
public interface GeoIpResolver {
  GeoIpResolver NONE = address -> Optional.empty();

  Optional<GeoIpRecord> resolve(InetAddress address);
}
