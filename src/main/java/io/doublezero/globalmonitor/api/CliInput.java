package io.doublezero.globalmonitor.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Monitor command line split into switches and {@code key=value} settings.
 */
public final class CliInput {

  /** Switches the monitor understands, with their accepted spellings. */
  enum Switch {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    DRY_RUN("--dry-run");

    private final Set<String> spellings;

    Switch(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Optional<Switch> lookup(String arg) {
      String lower = arg.toLowerCase(Locale.ROOT);
      for (Switch candidate : values()) {
        if (candidate.spellings.contains(lower)) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }
  }

  private final List<String> settings;
  private final Set<Switch> switches;

  private CliInput(List<String> settings, Set<Switch> switches) {
    this.settings = settings;
    this.switches = switches;
  }

  /**
   * Partitions raw arguments. Anything containing {@code '='} is a setting; bare words that are not
   * a known switch are passed on as settings so the settings parser reports them.
   *
   * @param args raw CLI arguments, may be {@code null}
   * @throws IllegalArgumentException for an unknown {@code -}-prefixed switch
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<Switch> switches = EnumSet.noneOf(Switch.class);
    if (args == null) {
      return new CliInput(List.of(), switches);
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      if (arg.indexOf('=') >= 0) {
        settings.add(arg);
        continue;
      }
      Optional<Switch> known = Switch.lookup(arg);
      if (known.isPresent()) {
        switches.add(known.get());
      } else if (arg.startsWith("-")) {
        throw new IllegalArgumentException("unknown option " + arg);
      } else {
        settings.add(arg);
      }
    }
    return new CliInput(List.copyOf(settings), switches);
  }

  public String[] keyValueArgs() {
    return settings.toArray(String[]::new);
  }

  public boolean help() {
    return switches.contains(Switch.HELP);
  }

  public boolean verbose() {
    return switches.contains(Switch.VERBOSE);
  }

  public boolean dryRun() {
    return switches.contains(Switch.DRY_RUN);
  }
}
