package io.doublezero.globalmonitor.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.doublezero.globalmonitor.domain.probe.PlanKind;
import io.doublezero.globalmonitor.domain.probe.ProbeFailReason;
import io.doublezero.globalmonitor.domain.probe.ProbePath;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeStats;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ResultsSummaryTest {

  @Test
  void bucketsSeparateSuccessFailureAndNotReady() {
    ResultsSummary summary = new ResultsSummary();
    summary.add(PlanKind.SOL_VAL_ICMP, ProbePath.PUBLIC_INTERNET, ok(10));
    summary.add(PlanKind.SOL_VAL_ICMP, ProbePath.PUBLIC_INTERNET, ok(20));
    summary.add(PlanKind.SOL_VAL_ICMP, ProbePath.PUBLIC_INTERNET,
        ProbeResult.failure(ProbeFailReason.TIMEOUT, null));
    summary.add(PlanKind.SOL_VAL_ICMP, ProbePath.PUBLIC_INTERNET,
        ProbeResult.failure(ProbeFailReason.NOT_READY, null));
    summary.add(PlanKind.SOL_VAL_ICMP, ProbePath.DOUBLEZERO,
        ProbeResult.failure(ProbeFailReason.NO_ROUTE, null));

    ResultsSummary.Bucket pub = summary.bucket(PlanKind.SOL_VAL_ICMP, ProbePath.PUBLIC_INTERNET);
    assertEquals(4, pub.total());
    assertEquals(2, pub.success());
    assertEquals(1, pub.failure());
    assertEquals(1, pub.notReady());
    assertEquals(1, pub.reasons().get(ProbeFailReason.TIMEOUT));
    assertEquals(15.0, pub.averageRttMillis(), 0.001);

    ResultsSummary.Bucket dz = summary.bucket(PlanKind.SOL_VAL_ICMP, ProbePath.DOUBLEZERO);
    assertEquals(1, dz.failure());
    assertEquals(0.0, dz.averageRttMillis());
    assertEquals(0, summary.bucket(PlanKind.DZ_USER_ICMP, ProbePath.PUBLIC_INTERNET).total());
  }

  @Test
  void logsOverlayBucketsOnlyWhenConfigured() {
    Logger logger = (Logger) LoggerFactory.getLogger(ResultsSummary.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    logger.setAdditive(false);
    try {
      ResultsSummary summary = new ResultsSummary();
      summary.add(PlanKind.DZ_USER_ICMP, ProbePath.PUBLIC_INTERNET, ok(5));

      summary.log(Duration.ofMillis(1500), false);
      List<ILoggingEvent> publicOnly = List.copyOf(appender.list);
      assertEquals(PlanKind.values().length, publicOnly.size());
      assertTrue(publicOnly.stream().noneMatch(e -> e.getFormattedMessage().contains("path=doublezero")));
      assertTrue(publicOnly.stream().anyMatch(e -> e.getFormattedMessage()
          .contains("kind=dz_user_icmp path=public_internet total=1 success=1")));

      appender.list.clear();
      summary.log(Duration.ofMillis(1500), true);
      assertEquals(PlanKind.values().length * 2, appender.list.size());
      assertTrue(appender.list.get(0).getFormattedMessage().contains("durationMs=1500"));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(true);
    }
  }

  private static ProbeResult ok(long rttMillis) {
    Duration rtt = Duration.ofMillis(rttMillis);
    return ProbeResult.success(ProbeStats.of(3, 3, rtt, rtt, Duration.ZERO));
  }
}
