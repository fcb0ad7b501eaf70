package io.doublezero.globalmonitor.infrastructure.quic;

import io.netty.channel.Channel;
import io.netty.handler.codec.quic.QuicChannel;
import io.netty.handler.codec.quic.QuicConnectionPathStats;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link QuicConnection} over a Netty {@link QuicChannel}.
 *
 * <p>Netty exposes only the latest path RTT, so minimum RTT, smoothed RTT and mean deviation are
 * derived here from successive samples using the RFC 9002 estimator.</p>
 */
final class NettyQuicConnection implements QuicConnection {
  private static final long STATS_TIMEOUT_MILLIS = 1_000;

  private final QuicChannel quicChannel;
  private final Channel datagramChannel;
  private long minRttNanos;
  private long smoothedRttNanos;
  private long rttVarNanos;
  private long latestRttNanos;

  NettyQuicConnection(QuicChannel quicChannel, Channel datagramChannel) {
    this.quicChannel = quicChannel;
    this.datagramChannel = datagramChannel;
  }

  @Override
  public synchronized QuicConnectionStats stats() throws IOException {
    QuicConnectionPathStats path;
    try {
      path = quicChannel.collectPathStats(0).get(STATS_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted while collecting path stats", ex);
    } catch (ExecutionException | TimeoutException ex) {
      throw new IOException("failed to collect path stats", ex);
    }
    sample(path.rtt());
    return new QuicConnectionStats(
        Duration.ofNanos(minRttNanos),
        Duration.ofNanos(latestRttNanos),
        Duration.ofNanos(smoothedRttNanos),
        Duration.ofNanos(rttVarNanos),
        path.sent(),
        path.recv());
  }

  private void sample(long rttNanos) {
    if (rttNanos <= 0 || rttNanos == latestRttNanos && smoothedRttNanos != 0) {
      return;
    }
    latestRttNanos = rttNanos;
    if (smoothedRttNanos == 0) {
      minRttNanos = rttNanos;
      smoothedRttNanos = rttNanos;
      rttVarNanos = rttNanos / 2;
      return;
    }
    minRttNanos = Math.min(minRttNanos, rttNanos);
    rttVarNanos = (3 * rttVarNanos + Math.abs(smoothedRttNanos - rttNanos)) / 4;
    smoothedRttNanos = (7 * smoothedRttNanos + rttNanos) / 8;
  }

  @Override
  public boolean isClosed() {
    return !quicChannel.isActive();
  }

  @Override
  public void close() {
    quicChannel.close();
    datagramChannel.close();
  }
}
