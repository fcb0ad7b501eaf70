package io.doublezero.globalmonitor.domain.net;

import io.doublezero.globalmonitor.domain.dz.User;
import java.net.InetAddress;
import java.util.Objects;

/**
 * Vantage point for one tick.
 *
 * @param publicIface public interface name
 * @param publicIp public IPv4 address
 * @param dzIface overlay interface name, {@code null} when overlay probing is inactive
 * @param dzIp overlay IPv4 address, {@code null} when inactive
 * @param metro configured metro code
 * @param metroName human readable metro name
 * @param host local host name
 * @param user registry entry for this host on the overlay, may be {@code null}
 */
public record Source(
    String publicIface,
    InetAddress publicIp,
    String dzIface,
    InetAddress dzIp,
    String metro,
    String metroName,
    String host,
    User user) {

  public Source {
    Objects.requireNonNull(publicIface, "publicIface");
    Objects.requireNonNull(publicIp, "publicIp");
    metro = metro == null ? "" : metro;
    metroName = metroName == null ? "" : metroName;
    host = host == null ? "" : host;
  }

  public boolean overlayActive() {
    return dzIface != null && !dzIface.isEmpty();
  }

  /** True when the interface is the overlay interface of this source. */
  public boolean isOverlayIface(String iface) {
    return overlayActive() && dzIface.equals(iface);
  }

  /** Exchange code of the device this source is connected to, empty when unknown. */
  public String exchangeCode() {
    return user == null ? "" : user.exchangeCode();
  }

  /** Copy of this source with overlay probing disabled. */
  public Source withoutOverlay() {
    return new Source(publicIface, publicIp, null, null, metro, metroName, host, user);
  }
}
