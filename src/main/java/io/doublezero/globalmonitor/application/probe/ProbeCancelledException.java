package io.doublezero.globalmonitor.application.probe;

/**
 * Raised when a probe observes cancellation of its context. Callers treat it as "no result".
 */
public final class ProbeCancelledException extends Exception {
  private static final long serialVersionUID = 1L;

  public ProbeCancelledException(String message) {
    super(message);
  }

  public ProbeCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
