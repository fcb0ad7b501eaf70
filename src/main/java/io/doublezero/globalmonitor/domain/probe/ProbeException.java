package io.doublezero.globalmonitor.domain.probe;

/**
 * Describes why a probe failed. Attached to {@link ProbeResult#failure()}; not thrown across the
 * target registry.
 */
public final class ProbeException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProbeException(String message) {
    super(message);
  }

  public ProbeException(String message, Throwable cause) {
    super(message, cause);
  }
}
