package io.doublezero.globalmonitor.validation;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written as {@code 500ms}, {@code 8s}, {@code 1m}, {@code 2h} or ISO-8601.
 */
public final class Durations {
  private static final Pattern SIMPLE = Pattern.compile("^(\\d+)(ms|s|m|h)$");

  private Durations() {
    // Utility
  }

  /**
   * @throws IllegalArgumentException when the text is not a duration or is not positive
   */
  public static Duration parsePositive(String name, String raw) {
    String text = Strings.requireNonBlank(name, raw).toLowerCase(Locale.ROOT);
    Duration value;
    Matcher m = SIMPLE.matcher(text);
    if (m.matches()) {
      long amount;
      try {
        amount = Long.parseLong(m.group(1));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(Strings.message(name, "is out of range: " + raw), ex);
      }
      value = switch (m.group(2)) {
        case "ms" -> Duration.ofMillis(amount);
        case "s" -> Duration.ofSeconds(amount);
        case "m" -> Duration.ofMinutes(amount);
        default -> Duration.ofHours(amount);
      };
    } else {
      try {
        value = Duration.parse(text.toUpperCase(Locale.ROOT));
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException(Strings.message(name, "must be a duration such as 8s or PT8S (was " + raw + ")"), ex);
      }
    }
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(Strings.message(name, "must be greater than 0"));
    }
    return value;
  }
}
