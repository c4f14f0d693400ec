package ca.gc.cra.pulse.config;

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
 * Reads a PULSE YAML file into the flat option map used on the command line.
 *
 * <p>The {@code common} section applies to every subcommand; the section named after the subcommand
 * ({@code run}, {@code replay}, {@code demo-engine}) is layered on top. Nested mappings join their
 * keys in camel case, so {@code surface: {width: 120}} sets {@code surfaceWidth} and
 * {@code otel: {endpoint: ...}} sets {@code otelEndpoint}. Sequences are accepted for
 * {@code command} and {@code selection} only.</p>
 *
 * @since 0.1.0
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads the options {@code mode} sees from {@code path}.
   *
   * @param path YAML file
   * @param mode subcommand whose section is layered over {@code common}
   * @return flat option map; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or does not have the expected shape
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed PULSE config " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<?, ?> sections = mapping(document, "top level of " + path);
    Map<String, String> options = new LinkedHashMap<>();
    for (String section : List.of(COMMON_SECTION, mode.trim().toLowerCase(Locale.ROOT))) {
      Object body = sections.get(section);
      if (body != null) {
        collect(mapping(body, "section " + section), "", options);
      }
    }
    return Optional.of(Map.copyOf(options));
  }

  private static void collect(Map<?, ?> source, String prefix, Map<String, String> options) {
    for (Map.Entry<?, ?> entry : source.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("option names must be non-blank strings (got " + entry.getKey() + ")");
      }
      String option = prefix.isEmpty() ? name.trim() : prefix + capitalize(name.trim());
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(nested, option, options);
      } else if (value instanceof Iterable<?> items) {
        options.put(option, joinList(option, items));
      } else {
        options.put(option, value == null ? "" : value.toString());
      }
    }
  }

  private static String joinList(String option, Iterable<?> items) {
    String separator = switch (option) {
      case "command" -> " ";
      case "selection" -> ",";
      default -> throw new IllegalArgumentException(option + " takes a single value, not a list");
    };
    boolean spaceSeparated = separator.equals(" ");
    StringJoiner joined = new StringJoiner(separator);
    for (Object item : items) {
      if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException(option + " entries must be plain values");
      }
      String text = item.toString();
      boolean splits = spaceSeparated ? text.chars().anyMatch(Character::isWhitespace) : text.contains(separator);
      if (text.isBlank() || splits) {
        throw new IllegalArgumentException(
            option + " entry '" + text + "' would not survive joining with '" + separator + "'");
      }
      joined.add(text);
    }
    return joined.toString();
  }

  private static Map<?, ?> mapping(Object node, String where) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(where + " must be a mapping of option names to values");
  }

  private static String capitalize(String name) {
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }
}
