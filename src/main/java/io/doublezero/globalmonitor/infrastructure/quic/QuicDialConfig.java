package io.doublezero.globalmonitor.infrastructure.quic;

import java.time.Duration;

/**
 * Transport settings for TPU QUIC dials.
 *
 * @param maxIdleTimeout idle timeout negotiated with the peer
 * @param handshakeIdleTimeout bound on handshake completion
 * @param keepAlivePeriod interval between keep-alive and stat samples
 * @param alpn application protocol offered during the handshake
 */
public record QuicDialConfig(
    Duration maxIdleTimeout, Duration handshakeIdleTimeout, Duration keepAlivePeriod, String alpn) {
  public static final String SOLANA_TPU_ALPN = "solana-tpu";
  public static final Duration DEFAULT_MAX_IDLE_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_HANDSHAKE_IDLE_TIMEOUT = Duration.ofSeconds(2);
  public static final Duration DEFAULT_KEEP_ALIVE_PERIOD = Duration.ofSeconds(1);

  public QuicDialConfig {
    maxIdleTimeout = positiveOr(maxIdleTimeout, DEFAULT_MAX_IDLE_TIMEOUT);
    handshakeIdleTimeout = positiveOr(handshakeIdleTimeout, DEFAULT_HANDSHAKE_IDLE_TIMEOUT);
    keepAlivePeriod = positiveOr(keepAlivePeriod, DEFAULT_KEEP_ALIVE_PERIOD);
    alpn = alpn == null || alpn.isBlank() ? SOLANA_TPU_ALPN : alpn;
  }

  public static QuicDialConfig defaults() {
    return new QuicDialConfig(null, null, null, null);
  }

  private static Duration positiveOr(Duration value, Duration fallback) {
    if (value == null || value.isZero() || value.isNegative()) {
      return fallback;
    }
    return value;
  }
}
