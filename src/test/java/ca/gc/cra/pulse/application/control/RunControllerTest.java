package ca.gc.cra.pulse.application.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.application.progress.ProgressGrouper;
import ca.gc.cra.pulse.application.state.TestStateAggregator;
import ca.gc.cra.pulse.domain.error.ChildProcessException;
import ca.gc.cra.pulse.domain.repr.Attr;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.ConfigRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.NodeRepr;
import ca.gc.cra.pulse.domain.repr.Phase;
import ca.gc.cra.pulse.domain.repr.ReportOutcome;
import ca.gc.cra.pulse.domain.repr.SessionRepr;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.domain.state.TestStatus;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RunControllerTest {
  private static final NodeId A = NodeId.of("tests/test_a.py::test_one");
  private static final NodeId B = NodeId.of("tests/test_a.py::test_two");

  private final AtomicLong now = new AtomicLong(1_000L);
  private RunController controller;

  @BeforeEach
  void setUp() {
    controller = new RunController(new TestStateAggregator(), new ProgressGrouper(), now::get,
        IndicatorStyle.STANDARD, 80, 24);
    controller.startRun(Set.of());
  }

  @Test
  void tracksPhasesAndTimings() {
    controller.onInit(new ConfigRepr(Path.of("/work"), Map.of(), List.of()));
    controller.onSessionStart(new SessionRepr(Attr.absent()));
    now.addAndGet(100);
    collect(A, B);
    now.addAndGet(50);
    controller.onCollectionFinish();
    controller.onStartRunPhase();
    run(A, ReportOutcome.PASSED);
    now.addAndGet(1_000);
    controller.onSessionEnd(0);

    List<TimeStats.Entry> entries = controller.timeStats().entries();
    assertEquals(List.of(RunController.INIT_PHASE, RunController.COLLECTION, RunController.EXECUTION),
        entries.stream().map(TimeStats.Entry::name).toList());
    assertEquals(Duration.ofMillis(100), entries.get(0).elapsed());
    assertEquals(Duration.ofMillis(50), entries.get(1).elapsed());
    assertEquals(Duration.ofMillis(1_000), entries.get(2).elapsed());
    assertEquals(Optional.of(Path.of("/work")), controller.rootPath());
    assertEquals(Optional.of(0), controller.sessionExitStatus());
    assertEquals("complete: selected=2", controller.collectionProgress());
    assertEquals(1, controller.layout().groups().size());
  }

  @Test
  void failingTestsFollowLatestResult() {
    startSession();
    run(A, ReportOutcome.FAILED);
    run(B, ReportOutcome.PASSED);

    assertEquals(Set.of(A), controller.failingTests());

    controller.startRun(Set.of(A));
    startSession();
    run(A, ReportOutcome.PASSED);

    assertTrue(controller.failingTests().isEmpty());
    assertEquals(TestStatus.PASSED, controller.state().lookup(A).orElseThrow().status());
    assertTrue(controller.state().lookup(B).orElseThrow().parked());
  }

  @Test
  void runningTestsAndPeakConcurrency() {
    startSession();
    controller.onStartTest(A);
    controller.onStartTest(B);

    assertEquals(Set.of(A, B), controller.runningTests());

    controller.onEndTest(A);

    assertEquals(Set.of(B), controller.runningTests());
    assertEquals(2, controller.peakRunning());
  }

  @Test
  void crashMarksUnfinishedTestsInterrupted() {
    startSession();
    run(A, ReportOutcome.PASSED);
    controller.onStartTest(B);

    controller.onRunFinished(new RunResult(-1, false,
        Optional.of(new ChildProcessException("engine died", -1))));

    assertEquals(TestStatus.INTERRUPTED, controller.state().lookup(B).orElseThrow().status());
    assertEquals(TestStatus.PASSED, controller.state().lookup(A).orElseThrow().status());
    assertTrue(controller.runningTests().isEmpty());
  }

  @Test
  void keyboardInterruptIsRemembered() {
    startSession();
    controller.onStartTest(A);

    controller.onKeyboardInterrupt("KeyboardInterrupt");
    controller.onRunFinished(RunResult.of(1, true));

    assertTrue(controller.interrupted());
    assertEquals(TestStatus.INTERRUPTED, controller.state().lookup(A).orElseThrow().status());
  }

  @Test
  void internalErrorsAreCollectedAndClearedPerRun() {
    controller.onInternalError("boom");

    assertEquals(List.of("boom"), controller.internalErrors());

    controller.startRun(Set.of());

    assertTrue(controller.internalErrors().isEmpty());
    assertFalse(controller.interrupted());
  }

  @Test
  void summaryListsOutcomeCounts() {
    startSession();
    run(A, ReportOutcome.PASSED);
    run(B, ReportOutcome.FAILED);

    List<String> summary = controller.summary(false);

    assertEquals(List.of(
        String.format("%-22s%4d", "TOTAL tests:", 2),
        String.format("%-22s%4d", "Passed (.):", 1),
        String.format("%-22s%4d", "Failed (F):", 1)), summary);
  }

  private void startSession() {
    controller.onSessionStart(new SessionRepr(Attr.absent()));
    collect(A, B);
    controller.onCollectionFinish();
    controller.onStartRunPhase();
  }

  private void collect(NodeId... ids) {
    controller.onCollectionStart();
    List<NodeRepr> items = new ArrayList<>();
    for (NodeId id : ids) {
      items.add(ItemRepr.of(id));
    }
    controller.onCollectReport(new CollectReportRepr(
        NodeId.of("tests/test_a.py"), ReportOutcome.PASSED, "collect", items, List.of(), null));
  }

  private void run(NodeId id, ReportOutcome callOutcome) {
    controller.onStartTest(id);
    controller.onTestReport(TestReportRepr.of(id, Phase.SETUP, ReportOutcome.PASSED));
    controller.onTestReport(TestReportRepr.of(id, Phase.CALL, callOutcome));
    controller.onTestReport(TestReportRepr.of(id, Phase.TEARDOWN, ReportOutcome.PASSED));
    controller.onEndTest(id);
  }
}
