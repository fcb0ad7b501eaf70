package io.doublezero.globalmonitor.application.port;

import java.io.IOException;

/**
 * Raised when a collaborator returns a payload that cannot be interpreted.
 */
public final class MonitorDataException extends IOException {
  public MonitorDataException(String message) {
    super(message);
  }

  public MonitorDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
