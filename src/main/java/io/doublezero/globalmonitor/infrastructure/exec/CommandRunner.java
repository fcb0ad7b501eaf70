package io.doublezero.globalmonitor.infrastructure.exec;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs a local command and returns its standard output.
 */
@FunctionalInterface
public interface CommandRunner {
  /**
   * @param command program and arguments
   * @param timeout maximum run time
   * @return captured standard output
   * @throws IOException when the command cannot start, exits non-zero or exceeds the timeout
   */
  String run(List<String> command, Duration timeout) throws IOException;

  /**
   * Runs a command whose non-zero exit still carries useful output.
   *
   * @throws IOException when the command cannot start or exceeds the timeout
   */
  default CommandOutput exec(List<String> command, Duration timeout) throws IOException {
    return new CommandOutput(0, run(command, timeout), "");
  }
}
