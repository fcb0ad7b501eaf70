package io.doublezero.globalmonitor.domain.solana;

/**
 * Base58 public key helpers.
 */
public final class PublicKeys {
  /** Base58 rendering of the all-zero key. */
  public static final String ZERO = "11111111111111111111111111111111";

  private PublicKeys() {
    // Utility
  }

  public static boolean isZero(String key) {
    return key == null || key.isBlank() || ZERO.equals(key);
  }
}
