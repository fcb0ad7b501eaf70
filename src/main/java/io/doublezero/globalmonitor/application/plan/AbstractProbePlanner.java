package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.application.port.Preflight;
import io.doublezero.globalmonitor.application.port.ProbeTargetFactory;
import io.doublezero.globalmonitor.domain.dz.User;
import io.doublezero.globalmonitor.domain.net.Route;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared overlay rules for the three planners.
 */
abstract class AbstractProbePlanner implements ProbePlanner {
  protected final ProbeTargetFactory targets;

  protected AbstractProbePlanner(ProbeTargetFactory targets) {
    this.targets = Objects.requireNonNull(targets, "targets");
  }

  /**
   * Preflight failing with {@link ProbeFailReason#NO_ROUTE} when {@code destination} is missing
   * from the tick's route table.
   */
  static Preflight routePreflight(Map<String, Route> routes, String destination) {
    return ctx -> routes.containsKey(destination)
        ? Optional.empty()
        : Optional.of(ProbeFailReason.NO_ROUTE);
  }

  /**
   * Users behind the source's own exchange are never probed over the overlay. An unknown exchange
   * (empty code) on either side matches nothing.
   */
  static boolean sameExchange(Source source, User user) {
    String code = source.exchangeCode();
    return !code.isEmpty() && code.equals(user.exchangeCode());
  }
}
