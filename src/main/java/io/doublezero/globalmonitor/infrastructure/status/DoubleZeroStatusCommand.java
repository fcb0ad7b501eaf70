package io.doublezero.globalmonitor.infrastructure.status;

import io.doublezero.globalmonitor.application.port.MonitorDataException;
import io.doublezero.globalmonitor.application.port.OverlayStatusSource;
import io.doublezero.globalmonitor.domain.dz.OverlayStatus;
import io.doublezero.globalmonitor.infrastructure.exec.CommandRunner;
import io.doublezero.globalmonitor.infrastructure.json.JsonTree;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Asks the local DoubleZero client for its session state via {@code status --json}.
 */
public final class DoubleZeroStatusCommand implements OverlayStatusSource {
  private static final Duration TIMEOUT = Duration.ofSeconds(10);

  private final CommandRunner runner;
  private final List<String> command;

  /**
   * @param runner command runner
   * @param executable client executable, for example {@code doublezero}
   */
  public DoubleZeroStatusCommand(CommandRunner runner, String executable) {
    this.runner = Objects.requireNonNull(runner, "runner");
    Objects.requireNonNull(executable, "executable");
    List<String> cmd = new ArrayList<>(List.of(executable.trim().split("\\s+")));
    cmd.add("status");
    cmd.add("--json");
    this.command = List.copyOf(cmd);
  }

  @Override
  public OverlayStatus status() throws IOException {
    return parse(runner.run(command, TIMEOUT));
  }

  /**
   * Connected when any entry reports its session up.
   */
  static OverlayStatus parse(String json) throws MonitorDataException {
    if (json == null || json.isBlank()) {
      return OverlayStatus.DISCONNECTED;
    }
    Object root;
    try {
      root = JsonTree.parse(json);
    } catch (IOException ex) {
      throw new MonitorDataException("Malformed doublezero status output", ex);
    }
    List<Object> entries = root instanceof List<?> ? JsonTree.asArray(root) : List.of(root);
    for (Object node : entries) {
      Map<String, Object> entry = JsonTree.asObject(node);
      Map<String, Object> session = JsonTree.asObject(entry.get("doublezero_status"));
      String state = JsonTree.string(session, "session_status");
      if (state != null && isUp(state)) {
        return new OverlayStatus(
            true,
            orEmpty(JsonTree.string(entry, "current_device")),
            orEmpty(JsonTree.string(entry, "metro")),
            orEmpty(JsonTree.string(entry, "network")));
      }
    }
    return OverlayStatus.DISCONNECTED;
  }

  private static boolean isUp(String state) {
    String normalized = state.trim().toLowerCase(Locale.ROOT);
    return normalized.equals("up") || normalized.endsWith(" up");
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }
}
