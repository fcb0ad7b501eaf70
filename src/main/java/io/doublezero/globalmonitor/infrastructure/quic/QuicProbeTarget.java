package io.doublezero.globalmonitor.infrastructure.quic;

import io.doublezero.globalmonitor.application.port.Preflight;
import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.probe.ProbeException;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeStats;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import io.netty.channel.ConnectTimeoutException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TPU QUIC handshake target with a cached connection reused across probes.
 *
 * <p>The check-then-dial sequence and every access to the cached connection run under a per-target
 * lock, independent of the target registry's lock.</p>
 */
public final class QuicProbeTarget implements ProbeTarget {
  private static final Logger log = LoggerFactory.getLogger(QuicProbeTarget.class);
  static final Duration DEFAULT_READY_WAIT = Duration.ofSeconds(5);
  private static final String INACTIVITY_TIMEOUT_TEXT = "no recent network activity";

  private final String iface;
  private final String hostPort;
  private final ProbeTargetId id;
  private final QuicDialConfig config;
  private final Preflight preflight;
  private final QuicDialer dialer;
  private final Duration readyWaitWithoutDeadline;
  private final ReentrantLock lock = new ReentrantLock();
  private QuicConnection connection;

  public QuicProbeTarget(
      String iface, String hostPort, QuicDialConfig config, Preflight preflight, QuicDialer dialer) {
    this(iface, hostPort, config, preflight, dialer, DEFAULT_READY_WAIT);
  }

  QuicProbeTarget(
      String iface,
      String hostPort,
      QuicDialConfig config,
      Preflight preflight,
      QuicDialer dialer,
      Duration readyWaitWithoutDeadline) {
    if (iface == null || iface.isBlank()) {
      throw new IllegalArgumentException("iface is required");
    }
    if (Ipv4.hostOf(hostPort) == null) {
      throw new IllegalArgumentException("address must be host:port: " + hostPort);
    }
    this.iface = iface;
    this.hostPort = hostPort;
    this.id = ProbeTargetId.tpuquic(iface, hostPort);
    this.config = config == null ? QuicDialConfig.defaults() : config;
    this.preflight = preflight == null ? Preflight.NONE : preflight;
    this.dialer = Objects.requireNonNull(dialer, "dialer");
    this.readyWaitWithoutDeadline = Objects.requireNonNull(readyWaitWithoutDeadline, "readyWaitWithoutDeadline");
  }

  @Override
  public ProbeTargetId id() {
    return id;
  }

  @Override
  public String iface() {
    return iface;
  }

  public String hostPort() {
    return hostPort;
  }

  @Override
  public ProbeResult probe(ProbeContext ctx) throws ProbeCancelledException {
    Optional<ProbeFailReason> blocked = preflight.check(ctx);
    if (blocked.isPresent()) {
      return ProbeResult.failure(blocked.get(), new ProbeException("preflight failed: " + blocked.get()));
    }

    lock.lock();
    try {
      boolean dialed;
      try {
        dialed = dialIfNeeded(ctx);
      } catch (TimeoutException ex) {
        return ProbeResult.failure(ProbeFailReason.TIMEOUT, ex);
      } catch (IOException ex) {
        if (isTimeout(ex)) {
          return ProbeResult.failure(ProbeFailReason.TIMEOUT, ex);
        }
        log.debug("tpuquic dial {} failed", id, ex);
        return ProbeResult.failure(ProbeFailReason.OTHER, ex);
      }
      if (connection == null) {
        return ProbeResult.failure(
            ProbeFailReason.OTHER, new ProbeException("connection is nil after dialing"));
      }

      QuicConnectionStats raw;
      try {
        raw = dialed ? awaitReady(connection, ctx) : connection.stats();
      } catch (IOException ex) {
        return ProbeResult.failure(ProbeFailReason.OTHER, ex);
      }
      if (raw == null || raw.looksUntouched()) {
        return ProbeResult.failure(ProbeFailReason.NOT_READY, new ProbeException("stats not ready"));
      }

      ProbeStats stats = ProbeStats.of(
          raw.packetsSent(), raw.packetsReceived(), raw.minRtt(), raw.smoothedRtt(), raw.meanDeviation());
      if (stats.packetsSent() > 0 && stats.packetsReceived() == 0) {
        return ProbeResult.failure(
            ProbeFailReason.PACKETS_LOST, stats, new ProbeException("no packets received"));
      }
      return ProbeResult.success(stats);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Dials when nothing is cached or the cached connection reports closed.
   *
   * @return {@code true} when a dial happened
   */
  boolean dialIfNeeded(ProbeContext ctx) throws IOException, TimeoutException, ProbeCancelledException {
    lock.lock();
    try {
      if (connection != null && !connection.isClosed()) {
        return false;
      }
      if (connection != null) {
        connection.close();
        connection = null;
      }
      connection = dialer.dial(iface, hostPort, config, ctx);
      return true;
    } finally {
      lock.unlock();
    }
  }

  QuicConnection cachedConnection() {
    lock.lock();
    try {
      return connection;
    } finally {
      lock.unlock();
    }
  }

  private QuicConnectionStats awaitReady(QuicConnection conn, ProbeContext ctx)
      throws IOException, ProbeCancelledException {
    Duration budget = ctx.remaining().orElse(readyWaitWithoutDeadline);
    long deadline = System.nanoTime() + budget.toNanos();
    Duration interval = config.keepAlivePeriod();
    QuicConnectionStats stats = conn.stats();
    while (stats.looksUntouched()) {
      long left = deadline - System.nanoTime();
      if (left <= 0) {
        break;
      }
      Duration pause = interval.toNanos() < left ? interval : Duration.ofNanos(left);
      if (!ctx.sleep(pause)) {
        stats = conn.stats();
        break;
      }
      stats = conn.stats();
    }
    return stats;
  }

  static boolean isTimeout(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof TimeoutException
          || current instanceof SocketTimeoutException
          || current instanceof ConnectTimeoutException) {
        return true;
      }
      String message = current.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains(INACTIVITY_TIMEOUT_TEXT)) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (connection != null) {
        connection.close();
        connection = null;
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return id.toString();
  }
}
