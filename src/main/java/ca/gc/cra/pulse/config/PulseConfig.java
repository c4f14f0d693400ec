package ca.gc.cra.pulse.config;

import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.validation.Numbers;
import ca.gc.cra.pulse.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Effective settings for one consumer run (live or replayed).
 * <p><strong>Why:</strong> A single immutable context object replaces process-wide globals; it is built
 * once by the CLI and handed to {@link CompositionRoot}.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate for the {@code run} and {@code replay}
 * commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse the flattened key/value map produced by {@link ConfigMerger}.</li>
 *   <li>Enforce ranges (chunk size, surface dimensions) and sentinel shape.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param command engine command line; empty for replay
 * @param workDir engine working directory; empty for the current directory
 * @param rootPath root path used to relativize node ids
 * @param chunkSize read size in bytes
 * @param sentinel frame sentinel token
 * @param surfaceWidth rendering surface width in columns
 * @param surfaceHeight rendering surface height in rows
 * @param stdSymbols whether to use plain ASCII status indicators
 * @param mergeStderr whether engine stderr is merged into the consumed output
 * @param selection node ids to run; empty for all
 * @param input recorded wire file for replay
 * @since 0.1.0
 */
public record PulseConfig(
    List<String> command,
    Optional<Path> workDir,
    Path rootPath,
    int chunkSize,
    String sentinel,
    int surfaceWidth,
    int surfaceHeight,
    boolean stdSymbols,
    boolean mergeStderr,
    Set<String> selection,
    Optional<Path> input) {

  /** Smallest accepted read size. */
  public static final int MIN_CHUNK_SIZE = 64;
  /** Largest accepted read size. */
  public static final int MAX_CHUNK_SIZE = 65_536;
  /** Default read size. */
  public static final int DEFAULT_CHUNK_SIZE = 1024;
  private static final int MAX_SENTINEL_LENGTH = 64;
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public PulseConfig {
    command = List.copyOf(Objects.requireNonNull(command, "command"));
    workDir = Objects.requireNonNullElse(workDir, Optional.empty());
    rootPath = Objects.requireNonNull(rootPath, "rootPath").toAbsolutePath().normalize();
    Numbers.requireRange("chunkSize", chunkSize, MIN_CHUNK_SIZE, MAX_CHUNK_SIZE);
    sentinel = Strings.requirePrintableToken("sentinel", sentinel, MAX_SENTINEL_LENGTH);
    Numbers.requireRange("surfaceWidth", surfaceWidth, 20, 1_000);
    Numbers.requireRange("surfaceHeight", surfaceHeight, 8, 1_000);
    selection = Set.copyOf(Objects.requireNonNull(selection, "selection"));
    input = Objects.requireNonNullElse(input, Optional.empty());
  }

  /**
   * Returns the built-in defaults: no command, current directory as root.
   *
   * @return default configuration
   */
  public static PulseConfig defaults() {
    return new PulseConfig(List.of(), Optional.empty(), Path.of("."), DEFAULT_CHUNK_SIZE,
        FrameFormat.DEFAULT_SENTINEL, 80, 24, false, true, Set.of(), Optional.empty());
  }

  /**
   * Builds a configuration from flattened key/value pairs; missing keys fall back to
   * {@link #defaults()}.
   *
   * @param options merged options
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PulseConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PulseConfig defaults = defaults();

    List<String> command = splitCommand(options.get("command"));
    Optional<Path> workDir = optionalPath("workDir", options.get("workDir"));
    String rootRaw = trim(options.get("rootPath"));
    Path rootPath = rootRaw.isEmpty() ? workDir.orElse(defaults.rootPath()) : parsePath("rootPath", rootRaw);
    int chunkSize = parseInt(options, "chunkSize", defaults.chunkSize(), MIN_CHUNK_SIZE, MAX_CHUNK_SIZE);
    String sentinelRaw = trim(options.get("sentinel"));
    String sentinel = sentinelRaw.isEmpty() ? defaults.sentinel() : sentinelRaw;
    int width = parseInt(options, "surfaceWidth", defaults.surfaceWidth(), 20, 1_000);
    int height = parseInt(options, "surfaceHeight", defaults.surfaceHeight(), 8, 1_000);
    boolean stdSymbols = parseBoolean(options.get("stdSymbols"), defaults.stdSymbols());
    boolean mergeStderr = parseBoolean(options.get("mergeStderr"), defaults.mergeStderr());
    Set<String> selection = parseSelection(options.get("selection"));
    Optional<Path> input = optionalPath("input", options.get("input"));

    return new PulseConfig(command, workDir, rootPath, chunkSize, sentinel, width, height, stdSymbols,
        mergeStderr, selection, input);
  }

  /** Frame format for this run's sentinel. */
  public FrameFormat frameFormat() {
    return new FrameFormat(sentinel);
  }

  private static List<String> splitCommand(String raw) {
    String trimmed = trim(raw);
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return List.of(WHITESPACE.split(trimmed));
  }

  private static Set<String> parseSelection(String raw) {
    String trimmed = trim(raw);
    if (trimmed.isEmpty()) {
      return Set.of();
    }
    Set<String> ids = new LinkedHashSet<>();
    List<String> rejected = new ArrayList<>();
    for (String token : trimmed.split(",")) {
      String id = token.trim();
      if (id.isEmpty()) {
        continue;
      }
      if (WHITESPACE.matcher(id).find()) {
        rejected.add(id);
      } else {
        ids.add(id);
      }
    }
    if (!rejected.isEmpty()) {
      throw new IllegalArgumentException("selection entries must not contain whitespace: " + rejected);
    }
    return ids;
  }

  private static int parseInt(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = trim(options.get(key));
    if (raw.isEmpty()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  private static Optional<Path> optionalPath(String name, String raw) {
    String trimmed = trim(raw);
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(parsePath(name, trimmed));
  }

  private static Path parsePath(String name, String raw) {
    try {
      return Path.of(raw);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false but was '" + value + "'");
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
