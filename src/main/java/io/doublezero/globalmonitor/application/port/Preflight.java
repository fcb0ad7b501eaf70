package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import java.util.Optional;

/**
 * Check run before any packet is sent; a present reason short-circuits the probe.
 */
@FunctionalInterface
public interface Preflight {
  Preflight NONE = ctx -> Optional.empty();

  Optional<ProbeFailReason> check(ProbeContext ctx);
}
