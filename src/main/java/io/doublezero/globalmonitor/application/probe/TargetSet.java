package io.doublezero.globalmonitor.application.probe;

import io.doublezero.globalmonitor.application.port.ClockPort;
import io.doublezero.globalmonitor.application.port.MetricsPort;
import io.doublezero.globalmonitor.application.port.ProbeTarget;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeTargetId;
import io.doublezero.globalmonitor.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Registry of live probe targets, keyed by id.
 * <p><strong>Why:</strong> Keeps cached protocol state (QUIC connections) alive across ticks while
 * guaranteeing that targets leaving the desired set are closed.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #update(Map)} reuses live instances for ids that stay and prunes the rest.</li>
 *   <li>{@link #prune(Map)} closes targets absent from the desired set on the bounded pool.</li>
 *   <li>{@link #executeProbes(ProbeContext)} probes every target with its own timeout.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One lock guards the registry and is held for the whole prune
 * and probe phases, so a target is never probed and closed at the same time. Concurrency within a
 * phase is bounded by a semaphore sized to {@code maxConcurrency}.</p>
 */
public final class TargetSet implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TargetSet.class);
  private static final Duration JOIN_GRACE = Duration.ofSeconds(1);

  private final TargetSetSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ExecutorService pool;
  private final Semaphore permits;
  private final ReentrantLock lock = new ReentrantLock();
  private Map<ProbeTargetId, ProbeTarget> targets = new HashMap<>();

  public TargetSet(TargetSetSettings settings, ClockPort clock, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.pool = ExecutorFactories.fixedPool("gm-probe", settings.maxConcurrency());
    this.permits = new Semaphore(settings.maxConcurrency());
  }

  /**
   * Replaces the registry with {@code desired}, keeping the existing instance for every id present
   * in both and closing targets that disappear.
   */
  public void update(Map<ProbeTargetId, ? extends ProbeTarget> desired) {
    lock.lock();
    try {
      Map<ProbeTargetId, ProbeTarget> next = new HashMap<>(desired.size());
      for (Map.Entry<ProbeTargetId, ? extends ProbeTarget> entry : desired.entrySet()) {
        ProbeTarget live = targets.get(entry.getKey());
        next.put(entry.getKey(), live != null ? live : entry.getValue());
      }
      pruneLocked(next);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes every registered target whose id is absent from {@code keep}, then replaces the
   * registry with {@code keep}. A {@code null} map closes everything.
   */
  public void prune(Map<ProbeTargetId, ? extends ProbeTarget> keep) {
    lock.lock();
    try {
      pruneLocked(keep == null ? new HashMap<>() : new HashMap<>(keep));
    } finally {
      lock.unlock();
    }
  }

  private void pruneLocked(Map<ProbeTargetId, ProbeTarget> keep) {
    List<ProbeTarget> stale = new ArrayList<>();
    for (Map.Entry<ProbeTargetId, ProbeTarget> entry : targets.entrySet()) {
      if (!keep.containsKey(entry.getKey())) {
        stale.add(entry.getValue());
      }
    }
    List<Future<?>> closing = new ArrayList<>(stale.size());
    try {
      for (ProbeTarget target : stale) {
        permits.acquire();
        closing.add(pool.submit(() -> {
          try {
            target.close();
          } finally {
            permits.release();
          }
        }));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted after scheduling {} of {} stale target closes", closing.size(), stale.size());
    }
    awaitCloses(stale, closing);
    if (!stale.isEmpty()) {
      log.debug("Pruned {} targets", stale.size());
      for (int i = 0; i < stale.size(); i++) {
        metrics.increment("gm.targets.pruned.total");
      }
    }
    targets = keep;
  }

  /** Waits for every scheduled close, logging each failure against its target. */
  private static void awaitCloses(List<ProbeTarget> stale, List<Future<?>> closing) {
    boolean interrupted = false;
    for (int i = 0; i < closing.size(); i++) {
      Future<?> future = closing.get(i);
      while (true) {
        try {
          future.get();
          break;
        } catch (InterruptedException ex) {
          interrupted = true;
        } catch (ExecutionException ex) {
          log.warn("Failed to close stale target {}", stale.get(i).id(), ex.getCause());
          break;
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Probes every registered target concurrently, each under its own timeout derived from {@code ctx}.
   *
   * <p>Cancelled probes and {@code null} results are omitted; probes that exceed their deadline
   * yield a {@link ProbeFailReason#TIMEOUT} result; other errors are logged and omitted. Every
   * result is stamped with the clock time captured when the phase starts.</p>
   *
   * @param ctx tick context
   * @return results by target id
   * @throws InterruptedException if the calling thread is interrupted while dispatching or joining
   */
  public Map<ProbeTargetId, ProbeResult> executeProbes(ProbeContext ctx) throws InterruptedException {
    lock.lock();
    try {
      Instant tickTime = clock.now();
      List<Pending> pending = new ArrayList<>(targets.size());
      Map<ProbeTargetId, ProbeResult> results = new HashMap<>();
      try {
        for (ProbeTarget target : targets.values()) {
          permits.acquire();
          ProbeContext probeCtx = ctx.withTimeout(settings.probeTimeout());
          Future<ProbeResult> future;
          try {
            future = pool.submit(() -> {
              try {
                return target.probe(probeCtx);
              } finally {
                permits.release();
              }
            });
          } catch (RuntimeException ex) {
            permits.release();
            probeCtx.close();
            throw ex;
          }
          pending.add(new Pending(target, probeCtx, future));
        }
        for (Pending p : pending) {
          collect(p, tickTime, results);
        }
      } catch (InterruptedException ex) {
        for (Pending p : pending) {
          p.future().cancel(true);
          p.ctx().close();
        }
        throw ex;
      }
      return results;
    } finally {
      lock.unlock();
    }
  }

  private void collect(Pending p, Instant tickTime, Map<ProbeTargetId, ProbeResult> results)
      throws InterruptedException {
    ProbeTargetId id = p.target().id();
    try {
      ProbeResult result = p.future().get(
          settings.probeTimeout().plus(JOIN_GRACE).toMillis(), TimeUnit.MILLISECONDS);
      if (result == null) {
        return;
      }
      ProbeResult stamped = result.withTimestamp(tickTime);
      logOutcome(id, stamped);
      results.put(id, stamped);
    } catch (TimeoutException ex) {
      p.future().cancel(true);
      results.put(id, ProbeResult.failure(ProbeFailReason.TIMEOUT, ex).withTimestamp(tickTime));
      logOutcome(id, results.get(id));
    } catch (CancellationException ex) {
      log.debug("Probe {} cancelled", id);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof ProbeCancelledException) {
        log.debug("Probe {} cancelled", id);
      } else if (cause instanceof TimeoutException) {
        ProbeResult timeout = ProbeResult.failure(ProbeFailReason.TIMEOUT, cause).withTimestamp(tickTime);
        logOutcome(id, timeout);
        results.put(id, timeout);
      } else {
        log.warn("Probe {} failed unexpectedly", id, cause);
      }
    } finally {
      p.ctx().close();
    }
  }

  private void logOutcome(ProbeTargetId id, ProbeResult result) {
    if (result.ok()) {
      if (settings.verboseSuccesses()) {
        log.debug("Probe {} ok stats={}", id, result.stats());
      }
    } else if (settings.verboseFailures()) {
      Throwable failure = result.failure();
      log.debug("Probe {} failed reason={} error={}", id, result.failReason(),
          failure == null ? "" : failure.getMessage());
    }
  }

  /** Number of registered targets. */
  public int size() {
    lock.lock();
    try {
      return targets.size();
    } finally {
      lock.unlock();
    }
  }

  ProbeTarget get(ProbeTargetId id) {
    lock.lock();
    try {
      return targets.get(id);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Probe pool did not terminate within 5s");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private record Pending(ProbeTarget target, ProbeContext ctx, Future<ProbeResult> future) {}
}
