package io.doublezero.globalmonitor.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Text checks for monitor settings. Messages start with the setting name so they can be shown to the
 * operator unchanged.
 */
public final class Strings {
  private static final Pattern KAFKA_TOPIC = Pattern.compile("[A-Za-z0-9._-]{1,249}");
  /** Linux caps interface names at IFNAMSIZ - 1. */
  private static final Pattern LINUX_IFACE = Pattern.compile("[A-Za-z0-9._@:-]{1,15}");

  private Strings() {
    // Utility
  }

  /**
   * Returns the trimmed value.
   *
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or holds control characters
   */
  public static String requireNonBlank(String name, String value) {
    Objects.requireNonNull(value, label(name));
    if (value.chars().anyMatch(Character::isISOControl)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /** Kafka topic name: up to 249 of {@code [A-Za-z0-9._-]}, other than {@code .} and {@code ..}. */
  public static String requireKafkaTopic(String name, String topic) {
    String trimmed = requireNonBlank(name, topic);
    if (!KAFKA_TOPIC.matcher(trimmed).matches() || trimmed.equals(".") || trimmed.equals("..")) {
      throw new IllegalArgumentException(message(name, "is not a valid Kafka topic: " + trimmed));
    }
    return trimmed;
  }

  public static String requireInterfaceName(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!LINUX_IFACE.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name, "is not a valid interface name: " + trimmed));
    }
    return trimmed;
  }

  /**
   * Printable ASCII of at most {@code maxLength} characters, for values handed to a child process or
   * to the OTel resource.
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "is longer than " + maxLength + " characters"));
    }
    if (!trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
      throw new IllegalArgumentException(message(name, "must be printable ASCII"));
    }
    return trimmed;
  }

  static String message(String name, String suffix) {
    return label(name) + " " + suffix;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
