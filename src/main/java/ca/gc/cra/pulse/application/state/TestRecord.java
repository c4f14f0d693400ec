package ca.gc.cra.pulse.application.state;

import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.Phase;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.domain.state.TestStatus;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-test lifecycle record owned by {@link TestStateAggregator}.
 *
 * <p>The status is a pure function of the three phase reports and the started, parked and interrupted
 * flags; it is cached until the next mutation. Mutators are package-private so only the aggregator can
 * change a record.</p>
 *
 * @since 0.1.0
 */
public final class TestRecord {
  private final NodeId nodeId;
  private final ItemRepr item;
  private final Map<Phase, TestReportRepr> reports = new EnumMap<>(Phase.class);
  private boolean started;
  private boolean parked;
  private boolean interrupted;
  private TestStatus cachedStatus;

  TestRecord(ItemRepr item) {
    this.item = Objects.requireNonNull(item, "item");
    this.nodeId = item.nodeId();
  }

  public NodeId nodeId() {
    return nodeId;
  }

  public ItemRepr item() {
    return item;
  }

  public Optional<TestReportRepr> report(Phase phase) {
    return Optional.ofNullable(reports.get(phase));
  }

  public Optional<TestReportRepr> setup() {
    return report(Phase.SETUP);
  }

  public Optional<TestReportRepr> call() {
    return report(Phase.CALL);
  }

  public Optional<TestReportRepr> teardown() {
    return report(Phase.TEARDOWN);
  }

  public boolean started() {
    return started;
  }

  public boolean parked() {
    return parked;
  }

  public boolean interrupted() {
    return interrupted;
  }

  /** A test is finished once its teardown report has arrived. */
  public boolean finished() {
    return reports.containsKey(Phase.TEARDOWN);
  }

  /**
   * Derives the display status, first match wins.
   *
   * @return current status
   */
  public TestStatus status() {
    if (cachedStatus == null) {
      cachedStatus = classify();
    }
    return cachedStatus;
  }

  public String indicator(IndicatorStyle style) {
    return status().indicator(style);
  }

  /** Sum of the recorded phase durations, in seconds. */
  public double duration() {
    double total = 0d;
    for (TestReportRepr report : reports.values()) {
      total += report.duration();
    }
    return total;
  }

  public Optional<TestReportRepr> passedReport() {
    return call().filter(TestReportRepr::passed);
  }

  /** Failed call, or else a setup error. */
  public Optional<TestReportRepr> failedReport() {
    Optional<TestReportRepr> failedCall = call().filter(TestReportRepr::failed);
    return failedCall.isPresent() ? failedCall : setupErrorReport();
  }

  public Optional<TestReportRepr> setupErrorReport() {
    return setup().filter(TestReportRepr::failed);
  }

  public Optional<TestReportRepr> teardownErrorReport() {
    return teardown().filter(TestReportRepr::failed);
  }

  public Optional<TestReportRepr> xfailedReport() {
    return call().filter(r -> (r.failed() || r.skipped()) && r.expectedFailure());
  }

  public Optional<TestReportRepr> xpassedReport() {
    return call().filter(r -> r.passed() && r.expectedFailure());
  }

  /** Skipped setup, or else a skipped call. */
  public Optional<TestReportRepr> skippedReport() {
    Optional<TestReportRepr> skippedSetup = setup().filter(TestReportRepr::skipped);
    return skippedSetup.isPresent() ? skippedSetup : call().filter(TestReportRepr::skipped);
  }

  /**
   * Most significant error: a failed call, else a setup error, else a teardown error.
   *
   * @return error report when any phase failed
   */
  public Optional<TestReportRepr> mainErrorReport() {
    Optional<TestReportRepr> report = call().filter(TestReportRepr::failed);
    if (report.isEmpty()) {
      report = setupErrorReport();
    }
    if (report.isEmpty()) {
      report = teardownErrorReport();
    }
    return report;
  }

  boolean hasReport(Phase phase) {
    return reports.containsKey(phase);
  }

  void store(TestReportRepr report) {
    reports.put(report.when(), report);
    cachedStatus = null;
  }

  void markStarted() {
    started = true;
    cachedStatus = null;
  }

  void park() {
    parked = true;
    cachedStatus = null;
  }

  void markInterrupted() {
    interrupted = true;
    cachedStatus = null;
  }

  void reset() {
    reports.clear();
    started = false;
    parked = false;
    interrupted = false;
    cachedStatus = null;
  }

  private TestStatus classify() {
    boolean finished = finished();
    if (interrupted && !finished) {
      return TestStatus.INTERRUPTED;
    }
    if (!started && reports.isEmpty()) {
      return TestStatus.NOT_STARTED;
    }
    if (started && !finished) {
      Optional<TestReportRepr> setup = setup();
      if (setup.isEmpty()) {
        return TestStatus.SETUP_RUNNING;
      }
      if (hasReport(Phase.CALL)) {
        return TestStatus.TEARDOWN_RUNNING;
      }
      if (setup.get().passed()) {
        return TestStatus.RUNNING;
      }
    }
    if (xfailedReport().isPresent()) {
      return TestStatus.XFAILED;
    }
    if (xpassedReport().isPresent()) {
      return TestStatus.XPASSED;
    }
    if (setupErrorReport().isPresent()) {
      return TestStatus.SETUP_ERRORED;
    }
    if (teardownErrorReport().isPresent()) {
      return TestStatus.TEARDOWN_ERRORED;
    }
    if (failedReport().isPresent()) {
      return TestStatus.FAILED;
    }
    if (passedReport().isPresent()) {
      return TestStatus.PASSED;
    }
    if (skippedReport().isPresent()) {
      return TestStatus.SKIPPED;
    }
    return TestStatus.UNKNOWN;
  }

  @Override
  public String toString() {
    return "TestRecord[" + nodeId + " " + status() + (parked ? " parked" : "") + "]";
  }
}
