package io.doublezero.globalmonitor.api;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Process exit codes of the monitor CLI.
 */
public enum ExitCode {
  SUCCESS(0),
  /** Unparseable command line. */
  INVALID_ARGS(2),
  /** Configuration file unreadable, or a collaborator failed while starting. */
  IO_ERROR(3),
  /** Settings parsed but failed validation. */
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  /** Startup was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Exit code for a failure that escaped startup or the run loop. */
  static ExitCode forFailure(Throwable failure) {
    if (failure instanceof InterruptedIOException) {
      return INTERRUPTED;
    }
    if (failure instanceof IOException) {
      return IO_ERROR;
    }
    if (failure instanceof IllegalArgumentException) {
      return CONFIG_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
