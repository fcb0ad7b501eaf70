package io.doublezero.globalmonitor.infrastructure.quic;

import java.io.IOException;

/**
 * Established QUIC connection kept alive between probes.
 */
public interface QuicConnection {
  QuicConnectionStats stats() throws IOException;

  boolean isClosed();

  void close();
}
