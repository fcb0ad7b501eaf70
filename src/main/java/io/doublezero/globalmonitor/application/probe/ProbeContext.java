package io.doublezero.globalmonitor.application.probe;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation and deadline scope handed to probes.
 *
 * <p>Contexts form a tree: cancelling a parent cancels every child created through
 * {@link #withTimeout(Duration)}, and a child's deadline never extends past its parent's.
 * Closing a child cancels it and detaches it from the parent.</p>
 *
 * <p><strong>Thread-safety:</strong> All methods are safe for concurrent use.</p>
 */
public final class ProbeContext implements AutoCloseable {
  private final ProbeContext parent;
  private final boolean hasDeadline;
  private final long deadlineNanos;
  private final CountDownLatch done = new CountDownLatch(1);
  private final Set<ProbeContext> children = ConcurrentHashMap.newKeySet();

  private ProbeContext(ProbeContext parent, boolean hasDeadline, long deadlineNanos) {
    this.parent = parent;
    this.hasDeadline = hasDeadline;
    this.deadlineNanos = deadlineNanos;
  }

  /** Root context without deadline; cancelled only explicitly. */
  public static ProbeContext background() {
    return new ProbeContext(null, false, 0L);
  }

  /**
   * Derives a child that expires after {@code timeout} or at this context's deadline, whichever
   * comes first.
   */
  public ProbeContext withTimeout(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    if (hasDeadline && deadlineNanos - deadline < 0) {
      deadline = deadlineNanos;
    }
    ProbeContext child = new ProbeContext(this, true, deadline);
    children.add(child);
    if (isCancelled()) {
      child.cancel();
    }
    return child;
  }

  public void cancel() {
    if (done.getCount() == 0) {
      return;
    }
    done.countDown();
    for (ProbeContext child : children) {
      child.cancel();
    }
  }

  public boolean isCancelled() {
    return done.getCount() == 0;
  }

  public boolean hasDeadline() {
    return hasDeadline;
  }

  /** Time left before the deadline, empty when the context has none. Never negative. */
  public Optional<Duration> remaining() {
    if (!hasDeadline) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())));
  }

  public boolean deadlineExceeded() {
    return hasDeadline && deadlineNanos - System.nanoTime() <= 0;
  }

  /** True once the context is cancelled or past its deadline. */
  public boolean isDone() {
    return isCancelled() || deadlineExceeded();
  }

  /**
   * Throws when the context has been cancelled.
   *
   * @throws ProbeCancelledException if cancelled
   */
  public void checkCancelled() throws ProbeCancelledException {
    if (isCancelled()) {
      throw new ProbeCancelledException("context cancelled");
    }
  }

  /**
   * Sleeps for {@code duration}, waking early at the deadline.
   *
   * @return {@code true} if the full duration elapsed, {@code false} if the deadline was reached
   * @throws ProbeCancelledException if the context is cancelled or the thread interrupted while waiting
   */
  public boolean sleep(Duration duration) throws ProbeCancelledException {
    long waitNanos = duration.toNanos();
    if (hasDeadline) {
      waitNanos = Math.min(waitNanos, Math.max(0L, deadlineNanos - System.nanoTime()));
    }
    try {
      if (done.await(waitNanos, TimeUnit.NANOSECONDS)) {
        throw new ProbeCancelledException("context cancelled");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ProbeCancelledException("interrupted", ex);
    }
    return !deadlineExceeded();
  }

  @Override
  public void close() {
    cancel();
    if (parent != null) {
      parent.children.remove(this);
    }
  }
}
