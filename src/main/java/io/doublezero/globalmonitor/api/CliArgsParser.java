package io.doublezero.globalmonitor.api;

import io.doublezero.globalmonitor.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parses {@code key=value} settings against the keys the monitor understands.
 */
public final class CliArgsParser {

  private CliArgsParser() {}

  /**
   * Splits each argument on its first {@code '='}; the value may itself contain {@code '='}.
   *
   * @param args settings, {@code null} yields an empty map
   * @param knownKeys accepted setting names
   * @return settings in argument order
   * @throws IllegalArgumentException for a malformed, unknown, blank or repeated setting
   */
  public static Map<String, String> toMap(String[] args, Set<String> knownKeys) {
    Objects.requireNonNull(knownKeys, "knownKeys");
    Map<String, String> settings = new LinkedHashMap<>();
    if (args == null) {
      return settings;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      int eq = raw.indexOf('=');
      if (eq < 0) {
        throw new IllegalArgumentException("expected key=value but got '" + raw.trim() + "'");
      }
      String key = raw.substring(0, eq).trim();
      if (!knownKeys.contains(key)) {
        throw new IllegalArgumentException("unknown setting '" + key + "'");
      }
      String value = Strings.requireNonBlank(key, raw.substring(eq + 1));
      if (settings.put(key, value) != null) {
        throw new IllegalArgumentException(key + " is given more than once");
      }
    }
    return settings;
  }
}
