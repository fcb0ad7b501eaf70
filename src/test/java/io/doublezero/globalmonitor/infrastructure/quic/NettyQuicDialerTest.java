package io.doublezero.globalmonitor.infrastructure.quic;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.netty.channel.embedded.EmbeddedChannel;
import java.io.IOException;
import java.net.BindException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class NettyQuicDialerTest {

  @Test
  void completedBindReturnsOpenChannel() throws Exception {
    EmbeddedChannel channel = new EmbeddedChannel();

    assertSame(channel, NettyQuicDialer.awaitBind(
        channel.newSucceededFuture(), Duration.ofSeconds(1), ProbeContext.background()));
    assertTrue(channel.isOpen());
    channel.close();
  }

  @Test
  void cancellationAfterBindClosesTheSocket() {
    EmbeddedChannel channel = new EmbeddedChannel();
    ProbeContext ctx = ProbeContext.background();
    ctx.cancel();

    assertThrows(ProbeCancelledException.class,
        () -> NettyQuicDialer.awaitBind(channel.newSucceededFuture(), Duration.ofSeconds(1), ctx));
    assertFalse(channel.isOpen());
  }

  @Test
  void failedBindClosesTheSocket() {
    EmbeddedChannel channel = new EmbeddedChannel();

    assertThrows(IOException.class, () -> NettyQuicDialer.awaitBind(
        channel.newFailedFuture(new BindException("address in use")), Duration.ofSeconds(1),
        ProbeContext.background()));
    assertFalse(channel.isOpen());
  }
}
