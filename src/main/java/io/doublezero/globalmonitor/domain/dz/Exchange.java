package io.doublezero.globalmonitor.domain.dz;

/**
 * Exchange (metro point of presence) in the DoubleZero registry.
 */
public record Exchange(String pubkey, String code, String name) {
  /** Placeholder for devices whose exchange is not in the snapshot. */
  public static final Exchange UNKNOWN = new Exchange("", "", "");

  public Exchange {
    pubkey = pubkey == null ? "" : pubkey;
    code = code == null ? "" : code;
    name = name == null ? "" : name;
  }
}
