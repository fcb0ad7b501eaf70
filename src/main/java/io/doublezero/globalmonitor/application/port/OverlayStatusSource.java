package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.domain.dz.OverlayStatus;
import java.io.IOException;

/**
 * Reports whether the local overlay session is live.
 */
public interface OverlayStatusSource {
  OverlayStatusSource ALWAYS_CONNECTED = () -> new OverlayStatus(true, "", "", "");

  OverlayStatus status() throws IOException;
}
