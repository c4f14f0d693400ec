package ca.gc.cra.pulse.domain.repr;

import java.util.Locale;

/**
 * Execution phase of a single test. Every test reports setup and teardown; call is omitted when
 * setup fails or skips.
 *
 * @since 0.1.0
 */
public enum Phase {
  SETUP,
  CALL,
  TEARDOWN;

  /** Lower-case name used on the wire. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire phase name.
   *
   * @param value phase name such as {@code "setup"}
   * @return phase
   * @throws IllegalArgumentException when the name is unknown
   */
  public static Phase fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("phase must not be blank");
    }
    try {
      return Phase.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown phase: " + value, ex);
    }
  }
}
