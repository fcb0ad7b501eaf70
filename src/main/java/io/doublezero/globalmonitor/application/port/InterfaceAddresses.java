package io.doublezero.globalmonitor.application.port;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Looks up addresses bound to local interfaces.
 */
public interface InterfaceAddresses {
  /**
   * Returns the first IPv4 address of the interface.
   *
   * @param iface interface name
   * @return address, empty when the interface has none
   * @throws IOException when the interface does not exist or cannot be read
   */
  Optional<InetAddress> firstIpv4(String iface) throws IOException;
}
