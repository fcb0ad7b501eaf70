package io.doublezero.globalmonitor.domain.dz;

import java.util.Locale;

/**
 * Registry user types. Multicast users do not accept unicast ICMP.
 */
public enum UserType {
  IBRL,
  IBRL_WITH_ALLOCATED_IP,
  EDGE_FILTERING,
  MULTICAST;

  /**
   * Parses registry spellings such as {@code IBRLWithAllocatedIP} or {@code ibrl_with_allocated_ip}.
   */
  public static UserType parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return IBRL;
    }
    String normalized = raw.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "ibrl" -> IBRL;
      case "ibrlwithallocatedip" -> IBRL_WITH_ALLOCATED_IP;
      case "edgefiltering" -> EDGE_FILTERING;
      case "multicast" -> MULTICAST;
      default -> throw new IllegalArgumentException("Unknown user type: " + raw);
    };
  }
}
