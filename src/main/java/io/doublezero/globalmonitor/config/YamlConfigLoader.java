package io.doublezero.globalmonitor.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the monitor's YAML file into the flat setting map taken by {@link MonitorConfig#fromMap}.
 *
 * <p>The {@code common} section applies first and the requested section overrides it. Nested groups
 * join into camel-case keys, so {@code kafka: {bootstrap: k1:9092}} yields {@code kafkaBootstrap}.
 * Lists of scalars join with commas.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * @param path YAML file
   * @param section section to apply over {@code common}, matched case-insensitively
   * @return settings, or empty when {@code path} is not a regular file
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or not shaped as sections
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }

    Map<String, String> settings = new LinkedHashMap<>();
    if (document == null) {
      return Optional.of(settings);
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(path + " must contain a mapping of sections");
    }
    for (String name : List.of(COMMON_SECTION, section.trim().toLowerCase(Locale.ROOT))) {
      Object body = sectionOf(root, name);
      if (body instanceof Map<?, ?> group) {
        flatten(group, "", settings);
      } else if (body != null) {
        throw new IllegalArgumentException("section '" + name + "' must be a mapping");
      }
    }
    return Optional.of(settings);
  }

  private static Object sectionOf(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<?, ?> group, String prefix, Map<String, String> out) {
    for (Map.Entry<?, ?> entry : group.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim();
      if (name.isEmpty()) {
        throw new IllegalArgumentException("YAML config contains a blank key");
      }
      String key = prefix.isEmpty()
          ? name
          : prefix + Character.toUpperCase(name.charAt(0)) + name.substring(1);
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(nested, key, out);
      } else if (value instanceof List<?> items) {
        out.put(key, joinScalars(key, items));
      } else {
        out.put(key, value == null ? "" : value.toString());
      }
    }
  }

  private static String joinScalars(String key, List<?> items) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof List<?>) {
        throw new IllegalArgumentException(key + " must be a list of plain values");
      }
      joined.add(String.valueOf(item));
    }
    return joined.toString();
  }
}
