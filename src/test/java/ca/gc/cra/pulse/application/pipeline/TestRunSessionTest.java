package ca.gc.cra.pulse.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.application.dispatch.MessageDispatcher;
import ca.gc.cra.pulse.application.port.TestEngineLauncher;
import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.domain.protocol.Message;
import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.infrastructure.codec.JacksonPayloadCodec;
import ca.gc.cra.pulse.support.RecordingHandler;
import ca.gc.cra.pulse.support.RecordingMetricsPort;
import ca.gc.cra.pulse.support.ScriptedEngineProcess;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestRunSessionTest {
  private final FrameFormat format = FrameFormat.defaults();
  private final JacksonPayloadCodec codec = new JacksonPayloadCodec();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private RecordingHandler handler;
  private TestRunSession session;

  @BeforeEach
  void setUp() {
    MessageDispatcher dispatcher = new MessageDispatcher(format, codec, metrics);
    handler = new RecordingHandler();
    dispatcher.addHandler(handler);
    session = new TestRunSession(dispatcher, metrics, 3);
  }

  @Test
  void cleanRunDeliversEverythingAndFinishesOnce() {
    String output = "collecting ...\n"
        + frame(MessageKind.WRITE, "hello") + "\n"
        + frame(MessageKind.SESSION_END, 0) + "\n"
        + "trailing text without newline";

    RunResult result = session.run(new ScriptedEngineProcess(output, 0));

    assertTrue(result.cleanExit());
    assertTrue(result.sessionEnded());
    assertEquals(List.of("write hello", "session_end 0"), handler.events());
    assertEquals(List.of("collecting ...", "trailing text without newline"), handler.outputLines());
    assertEquals(List.of(result), handler.results());
    assertEquals(List.of(4L), metrics.observed("session.lines"));
    assertFalse(session.isRunning());
  }

  @Test
  void streamClosingBeforeSessionEndIsAFailure() {
    String output = frame(MessageKind.START_RUN_PHASE) + "\n";

    RunResult result = session.run(new ScriptedEngineProcess(output, 0));

    assertFalse(result.cleanExit());
    assertFalse(result.sessionEnded());
    assertTrue(result.failure().orElseThrow().getMessage().contains("before the session ended"));
    assertEquals(1, handler.results().size());
  }

  @Test
  void unexpectedExitStatusIsAFailure() {
    String output = frame(MessageKind.SESSION_END, 3) + "\n";

    RunResult result = session.run(new ScriptedEngineProcess(output, 3));

    assertTrue(result.sessionEnded());
    assertFalse(result.cleanExit());
    assertEquals(3, result.exitCode());
  }

  @Test
  void testFailuresExitIsStillClean() {
    RunResult result = session.run(new ScriptedEngineProcess(frame(MessageKind.SESSION_END, 1) + "\n", 1));

    assertTrue(result.cleanExit());
    assertEquals(RunResult.EXIT_TESTS_FAILED, result.exitCode());
  }

  @Test
  void readFailureEndsTheStreamAndStillFinishes() {
    InputStream failing = new InputStream() {
      private boolean first = true;

      @Override
      public int read() throws IOException {
        throw new IOException("broken pipe");
      }

      @Override
      public int read(byte[] b) throws IOException {
        if (first) {
          first = false;
          byte[] line = "partial".getBytes(StandardCharsets.UTF_8);
          System.arraycopy(line, 0, b, 0, Math.min(b.length, line.length));
          return Math.min(b.length, line.length);
        }
        throw new IOException("broken pipe");
      }
    };

    RunResult result = session.run(new ScriptedEngineProcess(failing, 0));

    assertFalse(result.cleanExit());
    assertEquals(List.of("par"), handler.outputLines());
    assertEquals(1, handler.results().size());
  }

  @Test
  void sessionCanBeReusedForASecondRun() {
    session.run(new ScriptedEngineProcess(frame(MessageKind.SESSION_END, 0) + "\n", 0));
    RunResult second = session.run(new ScriptedEngineProcess("", 0));

    assertFalse(second.sessionEnded());
    assertEquals(2, handler.results().size());
  }

  @Test
  void cancelDestroysTheRunningProcess() {
    ScriptedEngineProcess idle = new ScriptedEngineProcess("", 0);
    session.cancel();
    assertFalse(idle.destroyed());

    MessageDispatcher dispatcher = new MessageDispatcher(format, codec, metrics);
    AtomicReference<TestRunSession> cancelling = new AtomicReference<>();
    dispatcher.addHandler(new RecordingHandler() {
      @Override
      public void onOutputLine(String line) {
        cancelling.get().cancel();
      }
    });
    cancelling.set(new TestRunSession(dispatcher, metrics, 64));
    ScriptedEngineProcess process = new ScriptedEngineProcess("line\n", 0);

    cancelling.get().run(process);

    assertTrue(process.destroyed());
    assertTrue(cancelling.get().currentProcess().isEmpty());
  }

  @Test
  void launchAndRunPassesCommandThrough() throws IOException {
    List<List<String>> launched = new ArrayList<>();
    TestEngineLauncher launcher = (command, workDir, environment) -> {
      launched.add(command);
      assertEquals(Path.of("/work"), workDir);
      assertEquals(Map.of("PULSE_SELECTION", "a.py::t"), environment);
      return new ScriptedEngineProcess(frame(MessageKind.SESSION_END, 0) + "\n", 0);
    };

    RunResult result = session.launchAndRun(launcher, List.of("engine", "--flag"), Path.of("/work"),
        Map.of("PULSE_SELECTION", "a.py::t"));

    assertTrue(result.cleanExit());
    assertEquals(List.of(List.of("engine", "--flag")), launched);
  }

  @Test
  void overlongUnterminatedLineIsDroppedAndReadingContinues() {
    long filler = 65L * 1024 * 1024;
    String tail = "\nafter\n" + frame(MessageKind.SESSION_END, 0) + "\n";
    InputStream output = new SequenceInputStream(repeating('x', filler),
        new ByteArrayInputStream(tail.getBytes(StandardCharsets.UTF_8)));
    TestRunSession wide = new TestRunSession(dispatcherWith(handler), metrics, 65536);

    RunResult result = assertDoesNotThrow(() -> wide.run(new ScriptedEngineProcess(output, 0)));

    assertTrue(result.cleanExit());
    assertEquals(List.of("after"), handler.outputLines());
    assertEquals(1, metrics.count("session.line.dropped"));
  }

  @Test
  void engineThatKeepsRunningAfterOutputClosesIsDestroyed() {
    TestRunSession bounded = new TestRunSession(dispatcherWith(handler), metrics, 64, Duration.ofMillis(20));
    ScriptedEngineProcess lingering = new ScriptedEngineProcess(
        new ByteArrayInputStream((frame(MessageKind.SESSION_END, 0) + "\n").getBytes(StandardCharsets.UTF_8)),
        143, true);

    RunResult result = bounded.run(lingering);

    assertTrue(lingering.destroyed());
    assertEquals(143, result.exitCode());
    assertFalse(result.cleanExit());
    assertEquals(1, handler.results().size());
  }

  private MessageDispatcher dispatcherWith(RecordingHandler recording) {
    MessageDispatcher dispatcher = new MessageDispatcher(format, codec, metrics);
    dispatcher.addHandler(recording);
    return dispatcher;
  }

  private static InputStream repeating(char value, long count) {
    return new InputStream() {
      private long remaining = count;

      @Override
      public int read() {
        if (remaining <= 0) {
          return -1;
        }
        remaining--;
        return value;
      }

      @Override
      public int read(byte[] b, int off, int len) {
        if (remaining <= 0) {
          return -1;
        }
        int n = (int) Math.min(len, remaining);
        Arrays.fill(b, off, off + n, (byte) value);
        remaining -= n;
        return n;
      }
    };
  }

  private String frame(MessageKind kind, Object... args) {
    List<String> tokens = new ArrayList<>();
    for (Object arg : args) {
      tokens.add(codec.encode(arg));
    }
    return format.frame(Message.of(kind, tokens));
  }
}
