package ca.gc.cra.pulse.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Layers mode defaults, YAML settings and command-line options into the flat map that
 * {@link PulseConfig#fromMap(Map)} and {@link DemoEngineConfig#fromMap(Map)} read.
 *
 * <p>Later layers win: command line over YAML over defaults. Conflicts and YAML keys the mode does
 * not know are reported through the warning sink rather than failing the run.</p>
 *
 * @since 0.1.0
 */
public final class ConfigMerger {
  private static final Set<String> METRICS_EXPORTERS = Set.of("otlp", "none");

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for a subcommand.
   *
   * @param mode subcommand ({@code run}, {@code replay}, {@code demo-engine})
   * @param yaml settings flattened from the YAML file, when one was given
   * @param cli command-line options (may be {@code null})
   * @param defaults defaults for the mode, usually {@link DefaultsForMode#asFlatMap(String)}
   * @param warn receives one message per conflict or unknown YAML key (may be {@code null})
   * @return immutable merged configuration
   * @throws IllegalArgumentException when the mode's required options are missing or a value is invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> sink = warn == null ? message -> { } : warn;
    Map<String, String> base = defaults == null ? Map.of() : defaults;
    Map<String, String> fromYaml = yaml.orElse(Map.of());

    Map<String, String> merged = new LinkedHashMap<>(base);
    fromYaml.forEach((key, value) -> {
      if (!base.isEmpty() && !base.containsKey(key)) {
        sink.accept("YAML key '" + key + "' is not a " + mode + " option");
      }
      merged.put(key, value);
    });

    if (cli != null) {
      for (Map.Entry<String, String> option : cli.entrySet()) {
        String key = option.getKey();
        String value = option.getValue();
        if (key == null || value == null) {
          continue;
        }
        String fromFile = fromYaml.get(key);
        if (fromFile != null && !fromFile.equals(value)) {
          sink.accept("command line " + key + "=" + value + " replaces YAML " + key + "=" + fromFile);
        }
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "run" -> require(effective, "command", "run needs an engine command: command=... or -- CMD");
      case "replay" -> require(effective, "input", "replay needs a recorded wire file: input=PATH");
      default -> { }
    }
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !METRICS_EXPORTERS.contains(exporter)) {
      throw new IllegalArgumentException("metricsExporter must be otlp or none (was '" + exporter + "')");
    }
  }

  private static void require(Map<String, String> effective, String key, String message) {
    if (trim(effective.get(key)).isEmpty()) {
      throw new IllegalArgumentException(message);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
