package io.doublezero.globalmonitor.api;

import io.doublezero.globalmonitor.application.pipeline.ProbeRunner;
import io.doublezero.globalmonitor.config.CompositionRoot;
import io.doublezero.globalmonitor.config.MonitorConfig;
import io.doublezero.globalmonitor.config.YamlConfigLoader;
import io.doublezero.globalmonitor.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point of the global monitor.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String CONFIG_SECTION = "monitor";
  private static final String CONFIG_KEY = "config";
  private static final Set<String> CLI_KEYS = cliKeys();

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the monitor until interrupted and returns the exit code without terminating the JVM.
   */
  static ExitCode run(String[] args) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.usage();
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.help();
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled");
    }

    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs(), CLI_KEYS);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.usage();
      return ExitCode.INVALID_ARGS;
    }

    MonitorConfig config;
    try {
      config = MonitorConfig.fromMap(mergeConfig(cli));
    } catch (IOException ex) {
      log.error("Failed to read configuration file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid monitor configuration: {}", ex.getMessage());
      CliPrinter.usage();
      return ExitCode.CONFIG_ERROR;
    }

    if (input.dryRun()) {
      CliPrinter.dryRun(config);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      ProbeRunner runner = root.probeRunner();
      CountDownLatch finished = new CountDownLatch(1);
      Thread hook = new Thread(() -> {
        log.info("Shutdown requested");
        runner.stop();
        try {
          finished.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }, "gm-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      try {
        runner.run();
      } finally {
        finished.countDown();
      }
      log.info("Monitor stopped");
      return ExitCode.SUCCESS;
    } catch (IOException | RuntimeException ex) {
      ExitCode code = ExitCode.forFailure(ex);
      log.error("Monitor failed with {}: {}", code, ex.getMessage(), ex);
      return code;
    }
  }

  /**
   * Applies CLI values over the YAML file named by {@code config=PATH}, when present.
   */
  static Map<String, String> mergeConfig(Map<String, String> cli) throws IOException {
    Map<String, String> args = new LinkedHashMap<>(cli);
    String path = args.remove(CONFIG_KEY);
    if (path == null || path.isBlank()) {
      return args;
    }
    Optional<Map<String, String>> yaml = YamlConfigLoader.load(Path.of(path.trim()), CONFIG_SECTION);
    if (yaml.isEmpty()) {
      throw new IOException("configuration file not found: " + path);
    }
    Map<String, String> merged = new LinkedHashMap<>(yaml.get());
    merged.putAll(args);
    return merged;
  }

  private static Set<String> cliKeys() {
    Set<String> keys = new HashSet<>(MonitorConfig.KEYS);
    keys.add(CONFIG_KEY);
    return Set.copyOf(keys);
  }
}
