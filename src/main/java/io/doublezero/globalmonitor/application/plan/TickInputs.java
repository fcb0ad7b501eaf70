package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.domain.dz.RegistrySnapshot;
import io.doublezero.globalmonitor.domain.net.Route;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.solana.SolanaSnapshot;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of everything planners and recorders read during one tick.
 *
 * @param solana gossip nodes and validators
 * @param registry DoubleZero registry
 * @param source vantage point
 * @param routes BGP routes by destination; empty when overlay probing is inactive
 */
public record TickInputs(
    SolanaSnapshot solana, RegistrySnapshot registry, Source source, Map<String, Route> routes) {
  public TickInputs {
    Objects.requireNonNull(solana, "solana");
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(source, "source");
    routes = routes == null ? Map.of() : Map.copyOf(routes);
  }
}
