package ca.gc.cra.pulse.domain.repr;

import java.util.Objects;

/**
 * Source location of a test as reported by the engine.
 *
 * @param path file path relative to the run root
 * @param line zero-based line number, or {@code -1} when unknown
 * @param domain human-readable test name used in reports
 * @since 0.1.0
 */
public record Location(String path, int line, String domain) {
  /** Marker for an unknown line number. */
  public static final int UNKNOWN_LINE = -1;

  public Location {
    Objects.requireNonNull(path, "path");
    domain = domain == null ? "" : domain;
    if (line < UNKNOWN_LINE) {
      line = UNKNOWN_LINE;
    }
  }
}
