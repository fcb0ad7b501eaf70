package io.doublezero.globalmonitor.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @Test
  void changesOnlyTheNamedLogger() {
    String name = LoggingConfigurator.MONITOR_LOGGER + ".probe";
    Logger target = (Logger) LoggerFactory.getLogger(name);
    Logger kafka = (Logger) LoggerFactory.getLogger("org.apache.kafka");
    Level kafkaBefore = kafka.getEffectiveLevel();
    try {
      assertTrue(LoggingConfigurator.setLevel(name, Level.TRACE));

      assertEquals(Level.TRACE, target.getLevel());
      assertEquals(kafkaBefore, kafka.getEffectiveLevel());
    } finally {
      target.setLevel(null);
    }
  }
}
