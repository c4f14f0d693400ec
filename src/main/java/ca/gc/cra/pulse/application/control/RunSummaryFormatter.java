package ca.gc.cra.pulse.application.control;

import ca.gc.cra.pulse.application.state.TestRecord;
import ca.gc.cra.pulse.application.state.TestStateAggregator;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.domain.state.TestStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * Renders the plain-text run summary: totals, per-outcome counts and optional phase timings.
 *
 * @since 0.1.0
 */
public final class RunSummaryFormatter {
  private static final int LABEL_WIDTH = 22;

  private record Row(String label, TestStatus indicatorOf,
      Function<TestStateAggregator, List<TestRecord>> view) {}

  private static final List<Row> ROWS = List.of(
      new Row("Passed", TestStatus.PASSED, TestStateAggregator::passed),
      new Row("Failed", TestStatus.FAILED, TestStateAggregator::failed),
      new Row("Expected failures", TestStatus.XFAILED, TestStateAggregator::xfailed),
      new Row("Unexpected passes", TestStatus.XPASSED, TestStateAggregator::xpassed),
      new Row("Not run", TestStatus.NOT_STARTED, TestStateAggregator::notRun),
      new Row("Skipped", TestStatus.SKIPPED, TestStateAggregator::skipped),
      new Row("Setup errors", TestStatus.SETUP_ERRORED, TestStateAggregator::setupErrored),
      new Row("Teardown errors", TestStatus.TEARDOWN_ERRORED, TestStateAggregator::teardownErrored));

  private final IndicatorStyle style;

  public RunSummaryFormatter(IndicatorStyle style) {
    this.style = Objects.requireNonNull(style, "style");
  }

  /**
   * Formats the summary.
   *
   * @param state aggregator to summarise
   * @param full include per-outcome rows
   * @param timings phase timings to append; may be {@code null}
   * @return summary lines
   */
  public List<String> format(TestStateAggregator state, boolean full, TimeStats timings) {
    List<String> lines = new ArrayList<>();
    lines.add(label("TOTAL tests") + count(state.items().size() + state.deselected().size()));
    if (!state.deselected().isEmpty()) {
      lines.add(label("Deselected") + count(state.deselected().size()));
    }
    if (!state.collectFailures().isEmpty()) {
      lines.add(label("Collection errors") + count(state.collectFailures().size()));
    }
    if (full) {
      for (Row row : ROWS) {
        int n = row.view().apply(state).size();
        if (n > 0) {
          lines.add(label(row.label() + " (" + row.indicatorOf().indicator(style) + ")") + count(n));
        }
      }
    }
    if (timings != null) {
      for (TimeStats.Entry entry : timings.entries()) {
        lines.add(label(entry.name()) + seconds(entry.elapsed()));
      }
      lines.add(label("Overall") + seconds(timings.total()));
    }
    return lines;
  }

  private static String label(String text) {
    String withColon = text + ":";
    StringBuilder sb = new StringBuilder(withColon);
    while (sb.length() < LABEL_WIDTH) {
      sb.append(' ');
    }
    return sb.toString();
  }

  private static String count(int n) {
    return String.format(Locale.ROOT, "%4d", n);
  }

  private static String seconds(Duration duration) {
    return String.format(Locale.ROOT, "%8.3fs", duration.toMillis() / 1000d);
  }
}
