package ca.gc.cra.pulse.domain.repr;

import java.util.Locale;

/**
 * Outcome carried by a collection or phase report.
 *
 * @since 0.1.0
 */
public enum ReportOutcome {
  PASSED,
  FAILED,
  SKIPPED;

  /** Lower-case name used on the wire. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire outcome name.
   *
   * @param value outcome such as {@code "passed"}
   * @return outcome
   * @throws IllegalArgumentException when the name is unknown
   */
  public static ReportOutcome fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("outcome must not be blank");
    }
    try {
      return ReportOutcome.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown outcome: " + value, ex);
    }
  }
}
