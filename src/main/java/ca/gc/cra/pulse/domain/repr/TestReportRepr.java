package ca.gc.cra.pulse.domain.repr;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Snapshot of one phase report (setup, call or teardown) for a single test.
 * <p><strong>Role:</strong> Stored by the aggregator in the matching phase slot of a test record.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param nodeId test identifier
 * @param when phase the report belongs to
 * @param outcome phase outcome
 * @param duration phase duration in seconds
 * @param start phase start time, epoch seconds
 * @param stop phase stop time, epoch seconds
 * @param location source location
 * @param sections captured output
 * @param longRepr failure description as text
 * @param wasXfail expected-failure reason; present marks an xfail-decorated test
 * @param workerId parallel worker that ran the phase
 * @since 0.1.0
 */
public record TestReportRepr(
    NodeId nodeId,
    Phase when,
    ReportOutcome outcome,
    double duration,
    double start,
    double stop,
    Attr<Location> location,
    List<Section> sections,
    Attr<String> longRepr,
    Attr<String> wasXfail,
    Attr<String> workerId) implements Representation {
  public TestReportRepr {
    Objects.requireNonNull(nodeId, "nodeId");
    Objects.requireNonNull(when, "when");
    Objects.requireNonNull(outcome, "outcome");
    location = Objects.requireNonNullElse(location, Attr.absent());
    sections = sections == null ? List.of() : List.copyOf(sections);
    longRepr = Objects.requireNonNullElse(longRepr, Attr.absent());
    wasXfail = Objects.requireNonNullElse(wasXfail, Attr.absent());
    workerId = Objects.requireNonNullElse(workerId, Attr.absent());
  }

  /**
   * Creates a minimal report, mostly useful for synthetic engines.
   *
   * @param nodeId test identifier
   * @param when phase
   * @param outcome outcome
   * @return report with absent optional attributes
   */
  public static TestReportRepr of(NodeId nodeId, Phase when, ReportOutcome outcome) {
    return new TestReportRepr(nodeId, when, outcome, 0d, 0d, 0d, null, null, null, null, null);
  }

  public boolean passed() {
    return outcome == ReportOutcome.PASSED;
  }

  public boolean failed() {
    return outcome == ReportOutcome.FAILED;
  }

  public boolean skipped() {
    return outcome == ReportOutcome.SKIPPED;
  }

  /** Returns {@code true} when the test was marked as an expected failure. */
  public boolean expectedFailure() {
    return wasXfail.isPresent();
  }

  /** Returns a copy whose node id is bound to {@code rootPath}. */
  public TestReportRepr withRoot(Path rootPath) {
    return new TestReportRepr(
        nodeId.withRoot(rootPath),
        when,
        outcome,
        duration,
        start,
        stop,
        location,
        sections,
        longRepr,
        wasXfail,
        workerId);
  }
}
