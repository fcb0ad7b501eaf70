package io.doublezero.globalmonitor.application.source;

import java.util.Locale;
import java.util.Map;

/**
 * Display names for metro codes.
 */
public final class MetroNames {
  private static final Map<String, String> NAMES = Map.ofEntries(
      Map.entry("ams", "Amsterdam"),
      Map.entry("atl", "Atlanta"),
      Map.entry("chi", "Chicago"),
      Map.entry("dal", "Dallas"),
      Map.entry("fra", "Frankfurt"),
      Map.entry("hkg", "Hong Kong"),
      Map.entry("lax", "Los Angeles"),
      Map.entry("lon", "London"),
      Map.entry("mia", "Miami"),
      Map.entry("nyc", "New York"),
      Map.entry("par", "Paris"),
      Map.entry("sao", "Sao Paulo"),
      Map.entry("sea", "Seattle"),
      Map.entry("sin", "Singapore"),
      Map.entry("syd", "Sydney"),
      Map.entry("tyo", "Tokyo"),
      Map.entry("waw", "Warsaw"),
      Map.entry("yyz", "Toronto"));

  private MetroNames() {
    // Utility
  }

  /** Display name for the code, or the code itself when unknown. */
  public static String nameOf(String code) {
    if (code == null || code.isBlank()) {
      return "";
    }
    return NAMES.getOrDefault(code.trim().toLowerCase(Locale.ROOT), code);
  }
}
