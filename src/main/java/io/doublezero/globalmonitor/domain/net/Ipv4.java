package io.doublezero.globalmonitor.domain.net;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * IPv4 helpers shared by planners and recording.
 */
public final class Ipv4 {
  private Ipv4() {
    // Utility
  }

  /** True when the address is a non-null, specified IPv4 address. */
  public static boolean usable(InetAddress address) {
    return address instanceof Inet4Address && !address.isAnyLocalAddress();
  }

  /** Dotted-quad text of an IPv4 address. */
  public static String text(InetAddress address) {
    return address.getHostAddress();
  }

  /** Network address of the enclosing /24, e.g. {@code 10.1.2.0}. */
  public static String block24(InetAddress address) {
    byte[] raw = address.getAddress();
    return (raw[0] & 0xff) + "." + (raw[1] & 0xff) + "." + (raw[2] & 0xff) + ".0";
  }

  /** {@code host:port} rendering used by QUIC target ids. */
  public static String hostPort(InetAddress address, int port) {
    return text(address) + ":" + port;
  }

  /** Host part of a {@code host:port} string, or {@code null} when malformed. */
  public static String hostOf(String hostPort) {
    if (hostPort == null) {
      return null;
    }
    int idx = hostPort.lastIndexOf(':');
    if (idx <= 0 || idx == hostPort.length() - 1) {
      return null;
    }
    return hostPort.substring(0, idx);
  }

  /**
   * Parses an IPv4 literal without name resolution.
   *
   * @return the address, or {@code null} when the text is not a dotted-quad literal
   */
  public static InetAddress parse(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    String[] parts = text.trim().split("\\.");
    if (parts.length != 4) {
      return null;
    }
    byte[] raw = new byte[4];
    for (int i = 0; i < 4; i++) {
      try {
        int octet = Integer.parseInt(parts[i]);
        if (octet < 0 || octet > 255) {
          return null;
        }
        raw[i] = (byte) octet;
      } catch (NumberFormatException ex) {
        return null;
      }
    }
    try {
      return InetAddress.getByAddress(raw);
    } catch (UnknownHostException ex) {
      return null;
    }
  }
}
