package io.doublezero.globalmonitor.infrastructure.net;

import io.doublezero.globalmonitor.application.port.InterfaceAddresses;
import java.io.IOException;
import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.util.Collections;
import java.util.Optional;

/**
 * {@link InterfaceAddresses} backed by {@link NetworkInterface}.
 */
public final class NetworkInterfaceAddresses implements InterfaceAddresses {
  @Override
  public Optional<InetAddress> firstIpv4(String iface) throws IOException {
    NetworkInterface nif = NetworkInterface.getByName(iface);
    if (nif == null) {
      throw new IOException("Interface not found: " + iface);
    }
    for (InetAddress address : Collections.list(nif.getInetAddresses())) {
      if (address instanceof Inet4Address && !address.isLinkLocalAddress()) {
        return Optional.of(address);
      }
    }
    return Optional.empty();
  }
}
