package io.doublezero.globalmonitor.infrastructure.exec;

import io.doublezero.globalmonitor.validation.Numbers;
import io.doublezero.globalmonitor.validation.Strings;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread factories and pools for probe workers and the QUIC event loop.
 *
 * <p>All threads are daemons named {@code <prefix>-<n>}; uncaught errors are logged, never
 * propagated to the JVM default handler.</p>
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final long IDLE_KEEP_ALIVE_SECONDS = 30L;

  private ExecutorFactories() {}

  public static ThreadFactory daemonThreads(String prefix) {
    String name = Strings.requireNonBlank("thread prefix", prefix);
    AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, name + "-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(
          (t, ex) -> log.error("Uncaught exception in {}", t.getName(), ex));
      return thread;
    };
  }

  /**
   * Fixed-size pool whose idle workers exit between ticks.
   *
   * @param prefix thread-name prefix
   * @param size worker count, 1 to 4096
   */
  public static ExecutorService fixedPool(String prefix, int size) {
    int workers = (int) Numbers.requireRange("pool size", size, 1, 4096);
    ThreadPoolExecutor pool = new ThreadPoolExecutor(
        workers,
        workers,
        IDLE_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        daemonThreads(prefix));
    pool.allowCoreThreadTimeOut(true);
    return pool;
  }
}
