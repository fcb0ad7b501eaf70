package io.doublezero.globalmonitor.validation;

import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Network endpoint validation.
 */
public final class Net {
  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /** Validates a {@code host:port} string with a hostname or IPv4 host. */
  public static String validateHostPort(String value) {
    String sanitized = Strings.requireNonBlank("host:port", value);
    int lastColon = sanitized.lastIndexOf(':');
    if (lastColon <= 0 || lastColon == sanitized.length() - 1) {
      throw new IllegalArgumentException("host:port must use HOST:PORT format (was " + sanitized + ")");
    }
    String host = sanitized.substring(0, lastColon);
    String portPart = sanitized.substring(lastColon + 1);
    if (host.indexOf(':') >= 0) {
      throw new IllegalArgumentException("IPv6 hosts are not supported: " + sanitized);
    }
    if (IPV4_PATTERN.matcher(host).matches()) {
      requireIpv4(host);
    } else {
      validateHostname(host);
    }
    Numbers.parseInt("port", portPart, 1, 65535);
    return sanitized;
  }

  /** Validates a comma separated list of {@code host:port} entries. */
  public static String validateHostPortList(String value) {
    String sanitized = Strings.requireNonBlank("bootstrap servers", value);
    for (String entry : sanitized.split(",")) {
      validateHostPort(entry.trim());
    }
    return sanitized;
  }

  /** Parses a dotted-quad IPv4 literal. */
  public static InetAddress requireIpv4(String value) {
    String sanitized = Strings.requireNonBlank("ipv4", value);
    if (!IPV4_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException("invalid IPv4 address: " + sanitized);
    }
    byte[] raw = new byte[4];
    String[] parts = sanitized.split("\\.");
    for (int i = 0; i < 4; i++) {
      raw[i] = (byte) Numbers.requireRange("IPv4 octet", Integer.parseInt(parts[i]), 0, 255);
    }
    try {
      return InetAddress.getByAddress(raw);
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException("invalid IPv4 address: " + sanitized, ex);
    }
  }

  /** Validates an absolute http(s) URI with a host. */
  public static URI validateHttpUri(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      URI uri = new URI(sanitized);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(name + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(name + " must include a host");
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " must be a valid URI", ex);
    }
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len);
    }
    for (String label : host.split("\\.", -1)) {
      if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
        throw new IllegalArgumentException("invalid hostname: " + host);
      }
      for (int i = 0; i < label.length(); i++) {
        char c = label.charAt(i);
        boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
        boolean edge = i == 0 || i == label.length() - 1;
        if (!alnum && (edge || c != '-')) {
          throw new IllegalArgumentException("invalid hostname: " + host);
        }
      }
    }
  }
}
