package io.doublezero.globalmonitor.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runtime log-level control for the monitor CLI.
 *
 * <p>{@code --verbose} raises the monitor's own loggers to DEBUG. Kafka, Netty and OpenTelemetry keep
 * the levels set in {@code logback.xml}.</p>
 */
public final class LoggingConfigurator {
  static final String MONITOR_LOGGER = "io.doublezero.globalmonitor";
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * @return {@code false} when the SLF4J backend is not Logback
   */
  public static boolean enableVerboseLogging() {
    return setLevel(MONITOR_LOGGER, Level.DEBUG);
  }

  static boolean setLevel(String loggerName, Level level) {
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.warn("Cannot change the level of {}: SLF4J backend is not Logback", loggerName);
      return false;
    }
    context.getLogger(loggerName).setLevel(level);
    return true;
  }
}
