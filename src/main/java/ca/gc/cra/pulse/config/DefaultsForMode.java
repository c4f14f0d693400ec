package ca.gc.cra.pulse.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each PULSE CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code run}, {@code replay}, {@code demo-engine})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "replay" -> buildReplayDefaults();
      case "demo-engine" -> buildDemoDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("sentinel", PulseConfig.defaults().sentinel());
    map.put("rootPath", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildConsumerDefaults() {
    PulseConfig defaults = PulseConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("chunkSize", Integer.toString(defaults.chunkSize()));
    map.put("surfaceWidth", Integer.toString(defaults.surfaceWidth()));
    map.put("surfaceHeight", Integer.toString(defaults.surfaceHeight()));
    map.put("stdSymbols", Boolean.toString(defaults.stdSymbols()));
    map.put("selection", "");
    map.put("timings", "true");
    return map;
  }

  private static Map<String, String> buildRunDefaults() {
    Map<String, String> map = buildConsumerDefaults();
    map.put("command", "");
    map.put("workDir", "");
    map.put("mergeStderr", Boolean.toString(PulseConfig.defaults().mergeStderr()));
    return map;
  }

  private static Map<String, String> buildReplayDefaults() {
    Map<String, String> map = buildConsumerDefaults();
    map.put("input", "");
    return map;
  }

  private static Map<String, String> buildDemoDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("modules", "4");
    map.put("testsPerModule", "25");
    map.put("workers", "1");
    map.put("seed", "12345");
    map.put("delayMillis", "0");
    map.put("selection", "");
    return map;
  }
}
