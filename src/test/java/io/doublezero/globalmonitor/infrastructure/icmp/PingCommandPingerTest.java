package io.doublezero.globalmonitor.infrastructure.icmp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.doublezero.globalmonitor.application.probe.ProbeCancelledException;
import io.doublezero.globalmonitor.application.probe.ProbeContext;
import io.doublezero.globalmonitor.infrastructure.exec.CommandOutput;
import io.doublezero.globalmonitor.infrastructure.exec.CommandRunner;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class PingCommandPingerTest {
  private static final String IPUTILS = String.join("\n",
      "PING 192.0.2.10 (192.0.2.10) 56(84) bytes of data.",
      "",
      "--- 192.0.2.10 ping statistics ---",
      "3 packets transmitted, 3 received, 0% packet loss, time 2003ms",
      "rtt min/avg/max/mdev = 10.125/12.500/14.875/1.939 ms",
      "");
  private static final String BUSYBOX = String.join("\n",
      "PING 192.0.2.10 (192.0.2.10): 56 data bytes",
      "",
      "--- 192.0.2.10 ping statistics ---",
      "3 packets transmitted, 2 packets received, 33% packet loss",
      "round-trip min/avg/max = 1.000/2.000/3.000 ms",
      "");
  private static final String ALL_LOST = String.join("\n",
      "PING 192.0.2.10 (192.0.2.10) 56(84) bytes of data.",
      "",
      "--- 192.0.2.10 ping statistics ---",
      "3 packets transmitted, 0 received, 100% packet loss, time 2040ms",
      "");

  private final InetAddress destination = InetAddress.getByAddress(new byte[] {(byte) 192, 0, 2, 10});

  PingCommandPingerTest() throws IOException {
  }

  @Test
  void buildsBoundBurstCommand() throws Exception {
    Recording runner = new Recording(new CommandOutput(0, IPUTILS, ""));
    PingCommandPinger pinger = new PingCommandPinger(runner);

    pinger.ping("doublezero0", destination, new IcmpSettings(3, Duration.ofMillis(500), 56),
        ProbeContext.background());

    assertEquals(List.of("ping", "-n", "-q", "-I", "doublezero0", "-c", "3", "-i", "0.5", "-s", "56",
        "-w", "3", "192.0.2.10"), runner.commands.get(0));
    assertEquals(Duration.ofMillis(3500), runner.timeouts.get(0));
  }

  @Test
  void wholeSecondIntervalHasNoFraction() throws Exception {
    Recording runner = new Recording(new CommandOutput(0, IPUTILS, ""));

    new PingCommandPinger(runner).ping("eth0", destination, IcmpSettings.defaults(), ProbeContext.background());

    List<String> command = runner.commands.get(0);
    assertEquals("1", command.get(command.indexOf("-i") + 1));
    assertEquals("4", command.get(command.indexOf("-w") + 1));
  }

  @Test
  void shortDeadlineCapsTheCommandBudget() throws Exception {
    Recording runner = new Recording(new CommandOutput(0, IPUTILS, ""));
    try (ProbeContext ctx = ProbeContext.background().withTimeout(Duration.ofMillis(1500))) {
      new PingCommandPinger(runner).ping("eth0", destination, IcmpSettings.defaults(), ctx);
    }

    List<String> command = runner.commands.get(0);
    assertEquals("2", command.get(command.indexOf("-w") + 1));
    assertTrue(runner.timeouts.get(0).compareTo(Duration.ofMillis(2500)) <= 0);
  }

  @Test
  void parsesIputilsSummary() throws Exception {
    IcmpStats stats = new PingCommandPinger(fixed(new CommandOutput(0, IPUTILS, "")))
        .ping("eth0", destination, IcmpSettings.defaults(), ProbeContext.background());

    assertEquals(3, stats.sent());
    assertEquals(3, stats.received());
    assertEquals(Duration.ofNanos(10_125_000), stats.rttMin());
    assertEquals(Duration.ofNanos(12_500_000), stats.rttAvg());
    assertEquals(Duration.ofNanos(1_939_000), stats.rttStdDev());
  }

  @Test
  void parsesBusyboxSummaryWithoutDeviation() throws Exception {
    IcmpStats stats = new PingCommandPinger(fixed(new CommandOutput(0, BUSYBOX, "")))
        .ping("eth0", destination, IcmpSettings.defaults(), ProbeContext.background());

    assertEquals(3, stats.sent());
    assertEquals(2, stats.received());
    assertEquals(Duration.ofMillis(1), stats.rttMin());
    assertEquals(Duration.ofMillis(2), stats.rttAvg());
    assertEquals(Duration.ZERO, stats.rttStdDev());
  }

  @Test
  void totalLossStillReportsCounters() throws Exception {
    IcmpStats stats = new PingCommandPinger(fixed(new CommandOutput(1, ALL_LOST, "")))
        .ping("eth0", destination, IcmpSettings.defaults(), ProbeContext.background());

    assertEquals(3, stats.sent());
    assertEquals(0, stats.received());
    assertEquals(Duration.ZERO, stats.rttAvg());
  }

  @Test
  void outputWithoutSummaryFails() {
    PingCommandPinger pinger = new PingCommandPinger(
        fixed(new CommandOutput(2, "", "ping: SO_BINDTODEVICE doublezero0: No such device")));

    IOException ex = assertThrows(IOException.class,
        () -> pinger.ping("doublezero0", destination, IcmpSettings.defaults(), ProbeContext.background()));

    assertTrue(ex.getMessage().contains("No such device"));
  }

  @Test
  void interruptedCommandIsCancellation() {
    CommandRunner runner = (command, timeout) -> {
      throw new InterruptedIOException("interrupted");
    };

    assertThrows(ProbeCancelledException.class, () -> new PingCommandPinger(runner)
        .ping("eth0", destination, IcmpSettings.defaults(), ProbeContext.background()));
  }

  @Test
  void runnerFailureAfterDeadlineIsTimeout() throws Exception {
    CommandRunner runner = (command, timeout) -> {
      try {
        Thread.sleep(80);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      throw new IOException("Command timed out");
    };

    try (ProbeContext ctx = ProbeContext.background().withTimeout(Duration.ofMillis(30))) {
      TimeoutException ex = assertThrows(TimeoutException.class,
          () -> new PingCommandPinger(runner).ping("eth0", destination, IcmpSettings.defaults(), ctx));
      assertInstanceOf(IOException.class, ex.getCause());
    }
  }

  @Test
  void cancelledContextNeverRunsTheCommand() {
    Recording runner = new Recording(new CommandOutput(0, IPUTILS, ""));
    ProbeContext ctx = ProbeContext.background();
    ctx.cancel();

    assertThrows(ProbeCancelledException.class,
        () -> new PingCommandPinger(runner).ping("eth0", destination, IcmpSettings.defaults(), ctx));
    assertTrue(runner.commands.isEmpty());
  }

  private static CommandRunner fixed(CommandOutput output) {
    return new Recording(output);
  }

  private static final class Recording implements CommandRunner {
    private final CommandOutput output;
    private final List<List<String>> commands = new ArrayList<>();
    private final List<Duration> timeouts = new ArrayList<>();

    Recording(CommandOutput output) {
      this.output = output;
    }

    @Override
    public String run(List<String> command, Duration timeout) {
      throw new AssertionError("exec expected");
    }

    @Override
    public CommandOutput exec(List<String> command, Duration timeout) {
      commands.add(command);
      timeouts.add(timeout);
      return output;
    }
  }
}
