package io.doublezero.globalmonitor.application.port;

import io.doublezero.globalmonitor.domain.solana.SolanaSnapshot;
import java.io.IOException;

/**
 * Provides gossip nodes and validators keyed by node identity.
 */
public interface ValidatorSource {
  SolanaSnapshot fetch() throws IOException;
}
