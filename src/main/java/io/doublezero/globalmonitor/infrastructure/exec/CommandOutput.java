package io.doublezero.globalmonitor.infrastructure.exec;

/**
 * Exit status and captured streams of a finished command.
 *
 * @param exitCode process exit status
 * @param stdout standard output
 * @param stderr standard error, possibly truncated
 */
public record CommandOutput(int exitCode, String stdout, String stderr) {
  public CommandOutput {
    stdout = stdout == null ? "" : stdout;
    stderr = stderr == null ? "" : stderr;
  }
}
