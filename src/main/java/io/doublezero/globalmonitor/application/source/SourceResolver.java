package io.doublezero.globalmonitor.application.source;

import io.doublezero.globalmonitor.application.port.InterfaceAddresses;
import io.doublezero.globalmonitor.application.port.OverlayStatusSource;
import io.doublezero.globalmonitor.domain.dz.OverlayStatus;
import io.doublezero.globalmonitor.domain.dz.RegistrySnapshot;
import io.doublezero.globalmonitor.domain.dz.User;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.net.Source;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the vantage point every tick.
 *
 * <p>The public side is mandatory: a missing public address fails resolution. The overlay side is
 * optional: when the overlay interface has no IPv4 address, no registry user owns that address, or
 * the local client reports the session down, overlay probing is disabled for the tick.</p>
 */
public final class SourceResolver {
  private static final Logger log = LoggerFactory.getLogger(SourceResolver.class);

  private final SourceSettings settings;
  private final InterfaceAddresses interfaces;
  private final OverlayStatusSource status;
  private final Supplier<String> hostname;

  public SourceResolver(
      SourceSettings settings,
      InterfaceAddresses interfaces,
      OverlayStatusSource status,
      Supplier<String> hostname) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.interfaces = Objects.requireNonNull(interfaces, "interfaces");
    this.status = Objects.requireNonNull(status, "status");
    this.hostname = Objects.requireNonNull(hostname, "hostname");
  }

  public SourceSettings settings() {
    return settings;
  }

  /**
   * Resolves only the public side of the vantage point.
   *
   * @throws IOException when the public address cannot be determined
   */
  public Source resolvePublic() throws IOException {
    InetAddress publicIp = settings.publicIp();
    if (publicIp == null) {
      publicIp = interfaces.firstIpv4(settings.publicIface())
          .orElseThrow(() -> new IOException("no IPv4 address on public interface " + settings.publicIface()));
    }
    return new Source(
        settings.publicIface(),
        publicIp,
        null,
        null,
        settings.metro(),
        MetroNames.nameOf(settings.metro()),
        hostname.get(),
        null);
  }

  /**
   * Resolves the full vantage point against the tick's registry snapshot.
   *
   * @throws IOException when the public address cannot be determined
   */
  public Source resolve(RegistrySnapshot registry) throws IOException {
    Source base = resolvePublic();
    if (!settings.overlayConfigured()) {
      return base;
    }
    String dzIface = settings.dzIface();
    Optional<InetAddress> dzIp;
    try {
      dzIp = interfaces.firstIpv4(dzIface);
    } catch (IOException ex) {
      log.warn("Overlay interface {} unavailable; overlay probing disabled this tick: {}", dzIface, ex.getMessage());
      return base;
    }
    if (dzIp.isEmpty()) {
      log.warn("Overlay interface {} has no IPv4 address; overlay probing disabled this tick", dzIface);
      return base;
    }
    User user = registry.usersByDzIp().get(Ipv4.text(dzIp.get()));
    if (user == null) {
      log.warn("No registry user owns overlay address {}; overlay probing disabled this tick", dzIp.get());
      return base;
    }
    OverlayStatus current;
    try {
      current = status.status();
    } catch (IOException ex) {
      log.warn("Overlay status unavailable; overlay probing disabled this tick: {}", ex.getMessage());
      return base;
    }
    if (!current.connected()) {
      log.warn("Overlay session reported down; overlay probing disabled this tick");
      return base;
    }
    return new Source(
        base.publicIface(),
        base.publicIp(),
        dzIface,
        dzIp.get(),
        base.metro(),
        base.metroName(),
        base.host(),
        user);
  }
}
