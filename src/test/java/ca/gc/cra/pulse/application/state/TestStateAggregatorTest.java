package ca.gc.cra.pulse.application.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.domain.repr.Attr;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.NodeRepr;
import ca.gc.cra.pulse.domain.repr.Phase;
import ca.gc.cra.pulse.domain.repr.ReportOutcome;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.state.CollectionUpdate;
import ca.gc.cra.pulse.domain.state.CompletionCounts;
import ca.gc.cra.pulse.domain.state.TestStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestStateAggregatorTest {
  private static final NodeId A = NodeId.of("tests/test_a.py::test_one");
  private static final NodeId B = NodeId.of("tests/test_a.py::test_two");
  private static final NodeId C = NodeId.of("tests/test_b.py::test_three");

  private TestStateAggregator aggregator;

  @BeforeEach
  void setUp() {
    aggregator = new TestStateAggregator();
    aggregator.prepareForRun(Set.of());
    aggregator.addCollected(collected("tests/test_a.py", A, B));
    aggregator.addCollected(collected("tests/test_b.py", C));
  }

  @Test
  void addCollectedIsIdempotentPerReport() {
    CollectionUpdate again = aggregator.addCollected(collected("tests/test_a.py", A, B));

    assertEquals(CollectionUpdate.NONE, again);
    assertEquals(List.of(A, B, C), new ArrayList<>(aggregator.items()));
  }

  @Test
  void failedAndSkippedCollectionReportsAreTracked() {
    NodeId broken = NodeId.of("tests/test_broken.py");
    NodeId skippedModule = NodeId.of("tests/test_skipped.py");

    CollectionUpdate failed = aggregator.addCollected(
        new CollectReportRepr(broken, ReportOutcome.FAILED, "collect", List.of(), List.of(),
            Attr.present("ImportError")));
    aggregator.addCollected(
        new CollectReportRepr(skippedModule, ReportOutcome.SKIPPED, "collect", List.of(), List.of(), null));

    assertTrue(failed.failed());
    assertEquals(Set.of(broken), aggregator.collectFailures().keySet());
    assertEquals(Set.of(skippedModule), aggregator.collectSkipped().keySet());
    assertEquals("complete: selected=3 skipped=1 failed=1", aggregator.formatCollectionProgress(true));
  }

  @Test
  void deselectionRemovesItems() {
    aggregator.deselect(List.of(ItemRepr.of(B)));

    assertEquals(Set.of(B), aggregator.deselected());
    assertEquals(List.of(A, C), new ArrayList<>(aggregator.items()));
    assertEquals("running: selected=2 deselected=1", aggregator.formatCollectionProgress(false));
  }

  @Test
  void statusFollowsTheTestLifecycle() {
    assertEquals(TestStatus.NOT_STARTED, status(A));

    aggregator.startTest(A);
    assertEquals(TestStatus.SETUP_RUNNING, status(A));

    aggregator.storeReport(report(A, Phase.SETUP, ReportOutcome.PASSED));
    assertEquals(TestStatus.RUNNING, status(A));

    aggregator.storeReport(report(A, Phase.CALL, ReportOutcome.PASSED));
    assertEquals(TestStatus.TEARDOWN_RUNNING, status(A));

    aggregator.storeReport(report(A, Phase.TEARDOWN, ReportOutcome.PASSED));
    assertEquals(TestStatus.PASSED, status(A));
    assertEquals(new CompletionCounts(1, 3), aggregator.completionCounts());
  }

  @Test
  void lonePassingCallReportClassifiesAsPassed() {
    aggregator.storeReport(report(A, Phase.CALL, ReportOutcome.PASSED));

    assertEquals(TestStatus.PASSED, status(A));
    assertEquals(List.of(A), ids(aggregator.passed()));
    assertEquals(new CompletionCounts(0, 3), aggregator.completionCounts());
  }

  @Test
  void classifiesOutcomes() {
    finish(A, ReportOutcome.PASSED, ReportOutcome.FAILED, ReportOutcome.PASSED);
    finish(B, ReportOutcome.FAILED, null, ReportOutcome.PASSED);
    finish(C, ReportOutcome.PASSED, ReportOutcome.PASSED, ReportOutcome.FAILED);

    assertEquals(TestStatus.FAILED, status(A));
    assertEquals(TestStatus.SETUP_ERRORED, status(B));
    assertEquals(TestStatus.TEARDOWN_ERRORED, status(C));
    assertEquals(List.of(A), ids(aggregator.failed()));
    assertEquals(List.of(B), ids(aggregator.setupErrored()));
    assertEquals(List.of(C), ids(aggregator.teardownErrored()));
    assertEquals(List.of(C), ids(aggregator.passed()));
  }

  @Test
  void expectedFailuresAreClassifiedBeforePlainOutcomes() {
    aggregator.startTest(A);
    aggregator.storeReport(report(A, Phase.SETUP, ReportOutcome.PASSED));
    aggregator.storeReport(xfail(A, ReportOutcome.SKIPPED));
    aggregator.storeReport(report(A, Phase.TEARDOWN, ReportOutcome.PASSED));
    aggregator.startTest(B);
    aggregator.storeReport(report(B, Phase.SETUP, ReportOutcome.PASSED));
    aggregator.storeReport(xfail(B, ReportOutcome.PASSED));
    aggregator.storeReport(report(B, Phase.TEARDOWN, ReportOutcome.PASSED));

    assertEquals(TestStatus.XFAILED, status(A));
    assertEquals(TestStatus.XPASSED, status(B));
    assertEquals(List.of(A), ids(aggregator.xfailed()));
    assertEquals(List.of(B), ids(aggregator.xpassed()));
    assertTrue(aggregator.skipped().isEmpty());
    assertTrue(aggregator.passed().isEmpty());
  }

  @Test
  void setupSkipIsSkipped() {
    finish(A, ReportOutcome.SKIPPED, null, ReportOutcome.PASSED);

    assertEquals(TestStatus.SKIPPED, status(A));
    assertEquals(List.of(A), ids(aggregator.skipped()));
  }

  @Test
  void duplicatePhaseReportIsIgnored() {
    aggregator.startTest(A);
    aggregator.storeReport(report(A, Phase.SETUP, ReportOutcome.PASSED));
    aggregator.storeReport(report(A, Phase.SETUP, ReportOutcome.FAILED));
    aggregator.storeReport(report(A, Phase.TEARDOWN, ReportOutcome.PASSED));
    aggregator.storeReport(report(A, Phase.TEARDOWN, ReportOutcome.PASSED));

    assertTrue(aggregator.lookup(A).orElseThrow().setup().orElseThrow().passed());
    assertEquals(1, aggregator.finishedCount());
  }

  @Test
  void storePhaseReportUsesTheGivenSlot() {
    aggregator.startTest(A);

    aggregator.storePhaseReport(A, Phase.SETUP, report(A, Phase.CALL, ReportOutcome.PASSED));

    TestRecord record = aggregator.lookup(A).orElseThrow();
    assertTrue(record.setup().isPresent());
    assertEquals(Phase.SETUP, record.setup().orElseThrow().when());
    assertFalse(record.call().isPresent());
  }

  @Test
  void unknownTestsAreIgnored() {
    NodeId stranger = NodeId.of("tests/test_z.py::test_unknown");

    assertTrue(aggregator.startTest(stranger).isEmpty());
    assertTrue(aggregator.storeReport(report(stranger, Phase.SETUP, ReportOutcome.PASSED)).isEmpty());
    assertEquals(0, aggregator.finishedCount());
  }

  @Test
  void markInterruptedFlagsOnlyUnfinishedRecords() {
    finish(A, ReportOutcome.PASSED, ReportOutcome.PASSED, ReportOutcome.PASSED);
    aggregator.startTest(B);
    aggregator.park(C);

    assertEquals(1, aggregator.markInterrupted());

    assertEquals(TestStatus.PASSED, status(A));
    assertEquals(TestStatus.INTERRUPTED, status(B));
    assertEquals(TestStatus.NOT_STARTED, status(C));
    assertEquals(List.of(B, C), ids(aggregator.notRun()));
  }

  @Test
  void parkAndResetPreparesAPartialRerun() {
    finish(A, ReportOutcome.PASSED, ReportOutcome.FAILED, ReportOutcome.PASSED);
    finish(B, ReportOutcome.PASSED, ReportOutcome.PASSED, ReportOutcome.PASSED);

    aggregator.prepareForRun(Set.of(A));
    aggregator.parkAndReset(Set.of(A));

    assertEquals(TestStatus.NOT_STARTED, status(A));
    assertFalse(aggregator.lookup(A).orElseThrow().parked());
    assertTrue(aggregator.lookup(B).orElseThrow().parked());
    assertEquals(TestStatus.PASSED, status(B));
    assertEquals(1, aggregator.finishedCount());
  }

  @Test
  void fullRunClearsEverything() {
    finish(A, ReportOutcome.PASSED, ReportOutcome.PASSED, ReportOutcome.PASSED);

    aggregator.prepareForRun(Set.of());

    assertTrue(aggregator.items().isEmpty());
    assertEquals(0, aggregator.finishedCount());
  }

  @Test
  void queryAndCountViews() {
    finish(A, ReportOutcome.PASSED, ReportOutcome.PASSED, ReportOutcome.PASSED);
    finish(B, ReportOutcome.PASSED, ReportOutcome.FAILED, ReportOutcome.PASSED);

    assertEquals(List.of(B, A), ids(aggregator.queryResults(List.of(B, A, NodeId.of("missing")))));
    assertEquals(3, aggregator.queryResults(List.of()).size());
    assertEquals(Map.of(TestStatus.PASSED, 1, TestStatus.FAILED, 1, TestStatus.NOT_STARTED, 1),
        aggregator.statusCounts());
  }

  @Test
  void durationSumsPhaseDurations() {
    aggregator.startTest(A);
    aggregator.storeReport(timed(A, Phase.SETUP, 0.5d));
    aggregator.storeReport(timed(A, Phase.CALL, 1.25d));
    aggregator.storeReport(timed(A, Phase.TEARDOWN, 0.25d));

    assertEquals(2.0d, aggregator.lookup(A).orElseThrow().duration(), 1e-9);
  }

  private void finish(NodeId id, ReportOutcome setup, ReportOutcome call, ReportOutcome teardown) {
    aggregator.startTest(id);
    aggregator.storeReport(report(id, Phase.SETUP, setup));
    if (call != null) {
      aggregator.storeReport(report(id, Phase.CALL, call));
    }
    aggregator.storeReport(report(id, Phase.TEARDOWN, teardown));
  }

  private TestStatus status(NodeId id) {
    return aggregator.lookup(id).orElseThrow().status();
  }

  private static List<NodeId> ids(List<TestRecord> records) {
    return records.stream().map(TestRecord::nodeId).toList();
  }

  private static TestReportRepr report(NodeId id, Phase phase, ReportOutcome outcome) {
    return TestReportRepr.of(id, phase, outcome);
  }

  private static TestReportRepr xfail(NodeId id, ReportOutcome outcome) {
    return new TestReportRepr(id, Phase.CALL, outcome, 0d, 0d, 0d, null, null, null,
        Attr.present("known issue"), null);
  }

  private static TestReportRepr timed(NodeId id, Phase phase, double duration) {
    return new TestReportRepr(id, phase, ReportOutcome.PASSED, duration, 0d, duration, null, null,
        null, null, null);
  }

  private static CollectReportRepr collected(String module, NodeId... ids) {
    List<NodeRepr> items = new ArrayList<>();
    for (NodeId id : ids) {
      items.add(ItemRepr.of(id));
    }
    return new CollectReportRepr(NodeId.of(module), ReportOutcome.PASSED, "collect", items, List.of(), null);
  }
}
