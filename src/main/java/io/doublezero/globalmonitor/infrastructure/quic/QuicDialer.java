package io.doublezero.globalmonitor.infrastructure.quic;

import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Establishes QUIC connections from a given interface.
 */
public interface QuicDialer {
  /**
   * @param iface source interface to bind
   * @param hostPort remote {@code host:port}
   * @param config transport settings
   * @param ctx deadline scope
   * @return connection; {@code null} is tolerated and reported as a failure by the caller
   * @throws TimeoutException when the handshake deadline expires
   * @throws IOException on any other dial failure
   * @throws ProbeCancelledException when the context is cancelled
   */
  QuicConnection dial(String iface, String hostPort, QuicDialConfig config, ProbeContext ctx)
      throws IOException, TimeoutException, ProbeCancelledException;
}
