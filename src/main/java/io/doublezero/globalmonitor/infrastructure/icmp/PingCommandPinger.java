package io.doublezero.globalmonitor.infrastructure.icmp;

import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.infrastructure.exec.CommandOutput;
import io.doublezero.globalmonitor.infrastructure.exec.CommandRunner;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link IcmpPinger} that runs the system {@code ping} bound to the source interface and reads its
 * summary lines. The burst is real ICMP echo; {@code ping} carries the raw-socket privilege.
 *
 * <p>Exit status 1 (no replies) still yields counters. Any output without a transmit summary is an
 * error.</p>
 */
public final class PingCommandPinger implements IcmpPinger {
  static final String DEFAULT_BINARY = "ping";
  private static final Duration GRACE = Duration.ofSeconds(1);
  private static final Pattern TRANSMITTED =
      Pattern.compile("(\\d+) packets transmitted, (\\d+) (?:packets )?received");
  private static final Pattern RTT = Pattern.compile(
      "(?:rtt|round-trip) min/avg/max(?:/mdev)? = ([\\d.]+)/([\\d.]+)/([\\d.]+)(?:/([\\d.]+))? ms");

  private final CommandRunner runner;
  private final String binary;

  public PingCommandPinger(CommandRunner runner) {
    this(runner, DEFAULT_BINARY);
  }

  PingCommandPinger(CommandRunner runner, String binary) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.binary = Objects.requireNonNull(binary, "binary");
  }

  @Override
  public IcmpStats ping(String iface, InetAddress destination, IcmpSettings settings, ProbeContext ctx)
      throws IOException, TimeoutException, ProbeCancelledException {
    ctx.checkCancelled();
    Duration burst = settings.interval().multipliedBy(settings.count()).plus(GRACE);
    Duration budget = ctx.remaining().filter(left -> left.compareTo(burst) < 0).orElse(burst);
    if (budget.isZero() || budget.isNegative()) {
      throw new TimeoutException("deadline exceeded before sending");
    }
    CommandOutput output;
    try {
      output = runner.exec(command(iface, destination, settings, budget), budget.plus(GRACE));
    } catch (InterruptedIOException ex) {
      throw new ProbeCancelledException("interrupted while pinging " + Ipv4.text(destination), ex);
    } catch (IOException ex) {
      if (ctx.deadlineExceeded()) {
        TimeoutException timeout = new TimeoutException("deadline exceeded while pinging");
        timeout.initCause(ex);
        throw timeout;
      }
      throw ex;
    }
    ctx.checkCancelled();
    return parse(output);
  }

  List<String> command(String iface, InetAddress destination, IcmpSettings settings, Duration budget) {
    long deadlineSeconds = Math.max(1L, (budget.toMillis() + 999) / 1000);
    return List.of(binary, "-n", "-q",
        "-I", iface,
        "-c", Integer.toString(settings.count()),
        "-i", seconds(settings.interval()),
        "-s", Integer.toString(settings.size()),
        "-w", Long.toString(deadlineSeconds),
        Ipv4.text(destination));
  }

  static IcmpStats parse(CommandOutput output) throws IOException {
    Matcher sent = TRANSMITTED.matcher(output.stdout());
    if (!sent.find()) {
      String detail = output.stderr().isBlank() ? output.stdout().trim() : output.stderr().trim();
      throw new IOException("ping exited with " + output.exitCode() + " without a summary: " + detail);
    }
    long transmitted = Long.parseLong(sent.group(1));
    long received = Long.parseLong(sent.group(2));
    Matcher rtt = RTT.matcher(output.stdout());
    if (!rtt.find()) {
      return new IcmpStats(transmitted, received, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }
    return new IcmpStats(transmitted, received,
        millis(rtt.group(1)), millis(rtt.group(2)), rtt.group(4) == null ? Duration.ZERO : millis(rtt.group(4)));
  }

  private static Duration millis(String value) {
    return Duration.ofNanos(new BigDecimal(value).movePointRight(6).longValue());
  }

  private static String seconds(Duration interval) {
    return BigDecimal.valueOf(interval.toMillis()).movePointLeft(3).stripTrailingZeros().toPlainString();
  }
}
