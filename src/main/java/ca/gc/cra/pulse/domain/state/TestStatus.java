package ca.gc.cra.pulse.domain.state;

import java.util.Locale;

/**
 * <strong>What:</strong> Display state of a single test, derived from its phase reports and flags.
 * <p><strong>Role:</strong> Domain classification consumed by progress and summary rendering.</p>
 * <p>Constants are declared in classification priority order.</p>
 *
 * @since 0.1.0
 */
public enum TestStatus {
  NOT_STARTED(".", "."),
  /** Started but cut short by a cancelled or crashed run. */
  INTERRUPTED("!", "!"),
  SETUP_RUNNING("↑", "↑"),
  RUNNING("r", "r"),
  TEARDOWN_RUNNING("↓", "↓"),
  XFAILED("f", "x"),
  XPASSED("p", "X"),
  SETUP_ERRORED("u", "E"),
  TEARDOWN_ERRORED("d", "E"),
  FAILED("✕", "F"),
  PASSED("✔", "."),
  SKIPPED("s", "s"),
  UNKNOWN("?", "?");

  private final String fancy;
  private final String standard;

  TestStatus(String fancy, String standard) {
    this.fancy = fancy;
    this.standard = standard;
  }

  /**
   * Returns the single-character indicator for this state.
   *
   * @param style symbol set
   * @return indicator text
   */
  public String indicator(IndicatorStyle style) {
    return style == IndicatorStyle.STANDARD ? standard : fancy;
  }

  /** Canonical lower-case name, e.g. {@code setup_errored}. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns {@code true} while the test is between start and teardown. */
  public boolean inProgress() {
    return this == SETUP_RUNNING || this == RUNNING || this == TEARDOWN_RUNNING;
  }
}
