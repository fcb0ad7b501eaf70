package io.doublezero.globalmonitor.application.probe;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProbeContextTest {

  @Test
  void backgroundHasNoDeadline() {
    ProbeContext root = ProbeContext.background();

    assertFalse(root.hasDeadline());
    assertTrue(root.remaining().isEmpty());
    assertFalse(root.isDone());
  }

  @Test
  void cancellingParentCancelsChildren() {
    ProbeContext root = ProbeContext.background();
    ProbeContext child = root.withTimeout(Duration.ofMinutes(1));
    ProbeContext grandchild = child.withTimeout(Duration.ofMinutes(1));

    root.cancel();

    assertTrue(child.isCancelled());
    assertTrue(grandchild.isCancelled());
    assertThrows(ProbeCancelledException.class, grandchild::checkCancelled);
  }

  @Test
  void childOfCancelledParentStartsCancelled() {
    ProbeContext root = ProbeContext.background();
    root.cancel();

    assertTrue(root.withTimeout(Duration.ofSeconds(1)).isCancelled());
  }

  @Test
  void childDeadlineNeverExceedsParent() {
    ProbeContext parent = ProbeContext.background().withTimeout(Duration.ofMillis(200));
    ProbeContext child = parent.withTimeout(Duration.ofMinutes(5));

    assertTrue(child.remaining().orElseThrow().compareTo(Duration.ofMillis(200)) <= 0);
  }

  @Test
  void sleepStopsAtDeadline() throws Exception {
    ProbeContext ctx = ProbeContext.background().withTimeout(Duration.ofMillis(50));

    assertFalse(ctx.sleep(Duration.ofSeconds(5)));
    assertTrue(ctx.deadlineExceeded());
    assertTrue(ctx.isDone());
    assertFalse(ctx.isCancelled());
  }

  @Test
  void sleepCompletesWithinBudget() throws Exception {
    ProbeContext ctx = ProbeContext.background().withTimeout(Duration.ofSeconds(5));

    assertTrue(ctx.sleep(Duration.ofMillis(10)));
  }

  @Test
  void sleepThrowsWhenCancelledMidway() throws Exception {
    ProbeContext ctx = ProbeContext.background().withTimeout(Duration.ofSeconds(5));
    Thread canceller = new Thread(() -> {
      try {
        Thread.sleep(50);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      ctx.cancel();
    });
    canceller.start();

    assertThrows(ProbeCancelledException.class, () -> ctx.sleep(Duration.ofSeconds(5)));
    canceller.join();
  }

  @Test
  void closingChildLeavesParentRunning() {
    ProbeContext root = ProbeContext.background();
    ProbeContext child = root.withTimeout(Duration.ofSeconds(1));

    child.close();

    assertTrue(child.isCancelled());
    assertFalse(root.isCancelled());
  }
}
