package ca.gc.cra.pulse.infrastructure.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.application.control.RunController;
import ca.gc.cra.pulse.application.dispatch.MessageDispatcher;
import ca.gc.cra.pulse.application.emit.PipeEmitter;
import ca.gc.cra.pulse.application.pipeline.TestRunSession;
import ca.gc.cra.pulse.application.port.ClockPort;
import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.progress.ProgressGrouper;
import ca.gc.cra.pulse.application.state.TestStateAggregator;
import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.domain.state.TestStatus;
import ca.gc.cra.pulse.infrastructure.codec.JacksonPayloadCodec;
import ca.gc.cra.pulse.support.RecordingHandler;
import ca.gc.cra.pulse.support.ScriptedEngineProcess;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DemoEngineTest {
  private static final Path ROOT = Path.of("/work/demo").toAbsolutePath();

  @Test
  void fullRunReachesTheConsumerIntact() throws InterruptedException {
    Outcome outcome = runDemo(1, Set.of());

    TestStateAggregator state = outcome.controller().state();
    assertEquals(20, state.items().size());
    assertEquals(20, state.finishedCount());
    assertTrue(outcome.result().cleanExit());
    assertEquals(outcome.exitStatus(), outcome.result().exitCode());
    assertEquals(outcome.exitStatus() == DemoEngine.EXIT_TESTS_FAILED,
        !outcome.controller().failingTests().isEmpty());
    assertEquals(ROOT, outcome.controller().rootPath().orElseThrow());
    assertTrue(state.statusCounts().keySet().stream().noneMatch(TestStatus::inProgress));
    assertTrue(outcome.recorder().events().contains("write_sep = test session starts"));
    assertEquals(2, outcome.controller().layout().groups().size());
  }

  @Test
  void parallelWorkersProduceTheSameOutcomes() throws InterruptedException {
    Outcome serial = runDemo(1, Set.of());
    Outcome parallel = runDemo(3, Set.of());

    Map<TestStatus, Integer> expected = serial.controller().state().statusCounts();
    assertEquals(expected, parallel.controller().state().statusCounts());
    assertEquals(serial.exitStatus(), parallel.exitStatus());
    assertTrue(parallel.recorder().reports().stream()
        .allMatch(r -> r.workerId().isPresent() && r.workerId().value().startsWith("gw")));
  }

  @Test
  void selectionDeselectsEverythingElse() throws InterruptedException {
    Set<String> selection = Set.of("test_editing.py::test_case_0", "test_moving.py::test_case_3");

    Outcome outcome = runDemo(1, selection);

    TestStateAggregator state = outcome.controller().state();
    assertEquals(Set.of(NodeId.of("test_editing.py::test_case_0"), NodeId.of("test_moving.py::test_case_3")),
        state.items());
    assertEquals(18, state.deselected().size());
    assertEquals(2, state.finishedCount());
  }

  @Test
  void rejectsNonPositiveSizes() {
    PipeEmitter emitter = new PipeEmitter(new ByteArrayOutputStream(), FrameFormat.defaults(),
        new JacksonPayloadCodec(), MetricsPort.NO_OP, false);

    assertThrows(IllegalArgumentException.class, () -> new DemoEngine(emitter, ROOT, 0, 1, 1, 1L, 0L));
    assertThrows(IllegalArgumentException.class, () -> new DemoEngine(emitter, ROOT, 1, 1, 0, 1L, 0L));
  }

  private static Outcome runDemo(int workers, Set<String> selection) throws InterruptedException {
    FrameFormat format = FrameFormat.defaults();
    ByteArrayOutputStream pipe = new ByteArrayOutputStream();
    PipeEmitter emitter = new PipeEmitter(pipe, format, new JacksonPayloadCodec(), MetricsPort.NO_OP, false);
    int exitStatus = new DemoEngine(emitter, ROOT, 2, 10, workers, 12345L, 0L).run(selection);

    MessageDispatcher dispatcher = new MessageDispatcher(format, new JacksonPayloadCodec(), MetricsPort.NO_OP);
    RunController controller = new RunController(new TestStateAggregator(), new ProgressGrouper(),
        ClockPort.SYSTEM, IndicatorStyle.STANDARD, 80, 24);
    RecordingHandler recorder = new RecordingHandler();
    dispatcher.addHandler(controller);
    dispatcher.addHandler(recorder);
    TestRunSession session = new TestRunSession(dispatcher, MetricsPort.NO_OP, 1024);
    controller.startRun(Set.of());
    RunResult result = session.run(
        new ScriptedEngineProcess(new ByteArrayInputStream(pipe.toByteArray()), exitStatus));
    return new Outcome(exitStatus, result, controller, recorder);
  }

  private record Outcome(int exitStatus, RunResult result, RunController controller, RecordingHandler recorder) {}
}
