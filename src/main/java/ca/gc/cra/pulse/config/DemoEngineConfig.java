package ca.gc.cra.pulse.config;

import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for the synthetic {@code demo-engine} command.
 *
 * @param rootPath root directory reported by the engine
 * @param modules number of test modules
 * @param testsPerModule tests per module
 * @param workers simulated parallel workers
 * @param seed outcome seed
 * @param delayMillis pause inside each test
 * @param sentinel frame sentinel token
 * @since 0.1.0
 */
public record DemoEngineConfig(
    Path rootPath, int modules, int testsPerModule, int workers, long seed, long delayMillis, String sentinel) {

  public DemoEngineConfig {
    rootPath = Objects.requireNonNull(rootPath, "rootPath").toAbsolutePath().normalize();
    Numbers.requireRange("modules", modules, 1, 1_000);
    Numbers.requireRange("testsPerModule", testsPerModule, 1, 10_000);
    Numbers.requireRange("workers", workers, 1, 64);
    Numbers.requireRange("delayMillis", delayMillis, 0, 60_000);
    Objects.requireNonNull(sentinel, "sentinel");
  }

  /**
   * Builds the demo settings from merged options.
   *
   * @param options merged options
   * @return validated settings
   */
  public static DemoEngineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String root = options.getOrDefault("rootPath", "").trim();
    Path rootPath;
    try {
      rootPath = Path.of(root.isEmpty() ? "." : root);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("rootPath is not a valid path: " + root, ex);
    }
    int modules = Numbers.parseIntInRange("modules", options.getOrDefault("modules", "4"), 1, 1_000);
    int tests = Numbers.parseIntInRange("testsPerModule", options.getOrDefault("testsPerModule", "25"), 1, 10_000);
    int workers = Numbers.parseIntInRange("workers", options.getOrDefault("workers", "1"), 1, 64);
    long seed;
    try {
      seed = Long.parseLong(options.getOrDefault("seed", "12345").trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("seed must be an integer", ex);
    }
    int delay = Numbers.parseIntInRange("delayMillis", options.getOrDefault("delayMillis", "0"), 0, 60_000);
    String sentinel = options.getOrDefault("sentinel", "").trim();
    return new DemoEngineConfig(rootPath, modules, tests, workers, seed, delay,
        sentinel.isEmpty() ? FrameFormat.DEFAULT_SENTINEL : sentinel);
  }
}
