package io.doublezero.globalmonitor.domain.dz;

/**
 * Local overlay session state reported by the DoubleZero client.
 *
 * @param connected whether the session is up
 * @param deviceCode current device code, may be empty
 * @param metro current metro, may be empty
 * @param network network environment name, may be empty
 */
public record OverlayStatus(boolean connected, String deviceCode, String metro, String network) {
  public static final OverlayStatus DISCONNECTED = new OverlayStatus(false, "", "", "");
}
