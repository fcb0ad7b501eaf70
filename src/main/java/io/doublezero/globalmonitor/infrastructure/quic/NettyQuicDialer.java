package io.doublezero.globalmonitor.infrastructure.quic;

import io.doublezero.globalmonitor.application.port.InterfaceAddresses;
import io.doublezero.globalmonitor.application.port.MetricsPort;
import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.infrastructure.exec.ExecutorFactories;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.handler.codec.quic.QuicChannel;
import io.netty.handler.codec.quic.QuicClientCodecBuilder;
import io.netty.handler.codec.quic.QuicSslContext;
import io.netty.handler.codec.quic.QuicSslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.util.concurrent.Future;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dials TPU QUIC endpoints with Netty's QUIC codec, binding the UDP socket to the source interface's
 * IPv4 address. Validator certificates are self-signed, so peer verification is disabled.
 */
public final class NettyQuicDialer implements QuicDialer, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(NettyQuicDialer.class);
  private static final long INITIAL_MAX_DATA = 10_000_000L;
  private static final long INITIAL_MAX_STREAM_DATA = 1_000_000L;

  private final EventLoopGroup group;
  private final InterfaceAddresses interfaces;
  private final MetricsPort metrics;

  public NettyQuicDialer(InterfaceAddresses interfaces, MetricsPort metrics, int threads) {
    this.interfaces = Objects.requireNonNull(interfaces, "interfaces");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.group = new MultiThreadIoEventLoopGroup(
        Math.max(1, threads), ExecutorFactories.daemonThreads("gm-quic"), NioIoHandler.newFactory());
  }

  @Override
  public QuicConnection dial(String iface, String hostPort, QuicDialConfig config, ProbeContext ctx)
      throws IOException, TimeoutException, ProbeCancelledException {
    ctx.checkCancelled();
    InetAddress local = interfaces.firstIpv4(iface)
        .orElseThrow(() -> new IOException("interface has no IPv4 address: " + iface));
    InetSocketAddress remote = parseRemote(hostPort);
    Duration handshakeBudget = config.handshakeIdleTimeout();
    Duration remaining = ctx.remaining().orElse(handshakeBudget);
    if (remaining.compareTo(handshakeBudget) < 0) {
      handshakeBudget = remaining;
    }

    QuicSslContext ssl = QuicSslContextBuilder.forClient()
        .trustManager(InsecureTrustManagerFactory.INSTANCE)
        .applicationProtocols(config.alpn())
        .build();
    ChannelHandler codec = new QuicClientCodecBuilder()
        .sslContext(ssl)
        .maxIdleTimeout(config.maxIdleTimeout().toMillis(), TimeUnit.MILLISECONDS)
        .initialMaxData(INITIAL_MAX_DATA)
        .initialMaxStreamDataBidirectionalLocal(INITIAL_MAX_STREAM_DATA)
        .build();

    ChannelFuture bound = new Bootstrap()
        .group(group)
        .channel(NioDatagramChannel.class)
        .handler(codec)
        .bind(new InetSocketAddress(local, 0));
    Channel datagram;
    try {
      datagram = awaitBind(bound, handshakeBudget, ctx);
    } catch (IOException | TimeoutException | ProbeCancelledException | RuntimeException ex) {
      metrics.increment("gm.probe.dial.total", Map.of("probe_type", "tpuquic", "outcome", "error"));
      throw ex;
    }

    Future<QuicChannel> connect = QuicChannel.newBootstrap(datagram)
        .streamHandler(new ChannelInboundHandlerAdapter())
        .remoteAddress(remote)
        .connect();
    try {
      await(connect, handshakeBudget, ctx);
    } catch (IOException | TimeoutException | ProbeCancelledException | RuntimeException ex) {
      connect.cancel(false);
      datagram.close();
      metrics.increment("gm.probe.dial.total", Map.of("probe_type", "tpuquic", "outcome", "error"));
      throw ex;
    }
    metrics.increment("gm.probe.dial.total", Map.of("probe_type", "tpuquic", "outcome", "ok"));
    log.debug("tpuquic connected {} -> {} via {}", local, remote, iface);
    return new NettyQuicConnection(connect.getNow(), datagram);
  }

  /**
   * Waits for the UDP bind; the channel is closed when the wait fails, whether the bind completed or not.
   */
  static Channel awaitBind(ChannelFuture bound, Duration budget, ProbeContext ctx)
      throws IOException, TimeoutException, ProbeCancelledException {
    try {
      return await(bound, budget, ctx).channel();
    } catch (IOException | TimeoutException | ProbeCancelledException | RuntimeException ex) {
      bound.cancel(false);
      bound.channel().close();
      throw ex;
    }
  }

  private static <T extends Future<?>> T await(T future, Duration budget, ProbeContext ctx)
      throws IOException, TimeoutException, ProbeCancelledException {
    boolean completed;
    try {
      completed = future.await(Math.max(1L, budget.toMillis()), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new ProbeCancelledException("interrupted while dialing", ex);
    }
    ctx.checkCancelled();
    if (!completed) {
      throw new TimeoutException("handshake did not complete within " + budget.toMillis() + "ms");
    }
    if (!future.isSuccess()) {
      throw new IOException("dial failed: " + future.cause().getMessage(), future.cause());
    }
    return future;
  }

  private static InetSocketAddress parseRemote(String hostPort) throws IOException {
    String host = Ipv4.hostOf(hostPort);
    InetAddress address = Ipv4.parse(host);
    if (address == null) {
      throw new IOException("invalid tpuquic address: " + hostPort);
    }
    try {
      int port = Integer.parseInt(hostPort.substring(hostPort.lastIndexOf(':') + 1));
      return new InetSocketAddress(address, port);
    } catch (NumberFormatException ex) {
      throw new IOException("invalid tpuquic port: " + hostPort, ex);
    }
  }

  @Override
  public void close() {
    group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
  }
}
