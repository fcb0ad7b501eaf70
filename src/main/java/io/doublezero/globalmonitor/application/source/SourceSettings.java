package io.doublezero.globalmonitor.application.source;

import java.net.InetAddress;
import java.util.Objects;

/**
 * Configured vantage point.
 *
 * @param publicIface public interface name
 * @param publicIp explicit public IPv4, {@code null} to read it from the interface
 * @param dzIface overlay interface name, {@code null} when the host is not on the overlay
 * @param metro metro code of this host
 */
public record SourceSettings(String publicIface, InetAddress publicIp, String dzIface, String metro) {
  public SourceSettings {
    Objects.requireNonNull(publicIface, "publicIface");
    if (publicIface.isBlank()) {
      throw new IllegalArgumentException("publicIface must not be blank");
    }
    dzIface = dzIface == null || dzIface.isBlank() ? null : dzIface.trim();
    metro = metro == null ? "" : metro.trim();
  }

  public boolean overlayConfigured() {
    return dzIface != null;
  }
}
