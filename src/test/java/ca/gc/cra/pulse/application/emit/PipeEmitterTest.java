package ca.gc.cra.pulse.application.emit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.application.dispatch.MessageDispatcher;
import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.domain.repr.NodeKind;
import ca.gc.cra.pulse.infrastructure.codec.JacksonPayloadCodec;
import ca.gc.cra.pulse.infrastructure.engine.EngineRecords;
import ca.gc.cra.pulse.support.RecordingHandler;
import ca.gc.cra.pulse.support.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PipeEmitterTest {
  private static final String TEST_ID = "tests/test_a.py::test_one";

  private final ByteArrayOutputStream pipe = new ByteArrayOutputStream();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final FrameFormat format = FrameFormat.defaults();

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(PipeEmitter.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    logger.setLevel(Level.WARN);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
  }

  @Test
  void emitsLifecycleInOrderWithRunPhaseMarker() {
    PipeEmitter emitter = emitter(pipe, false);
    emitter.start();

    emitter.configured(new EngineRecords.Config(Path.of("/work"), Map.of("verbose", 1), List.of()));
    emitter.sessionStart(new EngineRecords.Session(null));
    emitter.collectionStart();
    emitter.collectReport(new EngineRecords.CollectReport("tests/test_a.py", "passed",
        List.of(new EngineRecords.Node(TEST_ID, "test_one", NodeKind.FUNCTION, null, null)), null));
    emitter.collectionFinish();
    emitter.testStart(TEST_ID);
    emitter.testReport(report("setup", "passed"));
    emitter.testReport(report("call", "passed"));
    emitter.testReport(report("teardown", "passed"));
    emitter.testFinish(TEST_ID);
    emitter.sessionFinish(0);
    emitter.unconfigure();

    assertEquals(List.of(
        "init /work",
        "session_start",
        "test_collection_start",
        "test_collect_report tests/test_a.py",
        "test_collection_finish",
        "start_run_phase",
        "start_test " + TEST_ID,
        "test_report " + TEST_ID + " setup",
        "test_report " + TEST_ID + " call",
        "test_report " + TEST_ID + " teardown",
        "end_test " + TEST_ID,
        "session_end 0",
        "unconfigure"), decode().events());
    assertEquals(EmitterPhase.DONE, emitter.phase());
    assertEquals(13, metrics.count("emit.queue.enqueued"));
  }

  @Test
  void everyLineIsAFrameOfPrintableAscii() {
    PipeEmitter emitter = emitter(pipe, false);
    emitter.writeLine("héllo wörld\twith tabs");
    emitter.writeSep("=", "title with spaces");
    emitter.shutdown();

    String[] lines = pipe.toString(StandardCharsets.US_ASCII).split("\n");
    assertEquals(2, lines.length);
    for (String line : lines) {
      assertTrue(format.isFrame(line), line);
      assertTrue(line.chars().allMatch(c -> c >= 0x20 && c < 0x7f), line);
    }
    assertEquals(List.of("write_line héllo wörld\twith tabs", "write_sep = title with spaces"),
        decode().events());
  }

  @Test
  void startRunPhaseWaitsForCollectionToFinish() {
    PipeEmitter emitter = emitter(pipe, false);
    emitter.collectionStart();
    emitter.testStart(TEST_ID);
    emitter.collectionFinish();
    emitter.testStart("tests/test_a.py::test_two");
    emitter.shutdown();

    String[] lines = pipe.toString(StandardCharsets.US_ASCII).split("\n");
    assertTrue(lines[1].startsWith(format.sentinel() + " start_test "));
    assertTrue(lines[3].startsWith(format.sentinel() + " start_run_phase"));
  }

  @Test
  void duplicateCollectReportsAndWarningsAreDropped() {
    PipeEmitter emitter = emitter(pipe, false);
    EngineRecords.CollectReport report =
        new EngineRecords.CollectReport("tests/test_a.py", "passed", List.of(), null);
    EngineRecords.Warning warning = new EngineRecords.Warning(
        "deprecated", "DeprecationWarning", "runtest", TEST_ID, "tests/test_a.py", 3, "test_one");

    emitter.collectReport(report);
    emitter.collectionStart();
    emitter.collectReport(report);
    emitter.warningRecorded(warning);
    emitter.warningRecorded(warning);
    emitter.shutdown();

    assertEquals(List.of(
        "test_collection_start",
        "test_collect_report tests/test_a.py",
        "warning_recorded deprecated"), decode().events());
    assertEquals(1, metrics.count("emit.collect.duplicateDropped"));
  }

  @Test
  void workerGroupSuffixIsStripped() {
    PipeEmitter emitter = emitter(pipe, false);
    emitter.testStart(TEST_ID + "@group1");
    emitter.testFinish("tests/test_a.py::test_p[a@b]");
    emitter.shutdown();

    List<String> events = decode().events();
    assertEquals("start_test " + TEST_ID, events.get(1));
    assertEquals("end_test tests/test_a.py::test_p[a@b]", events.get(2));
  }

  @Test
  void messagesAfterShutdownAreDropped() {
    PipeEmitter emitter = emitter(pipe, false);
    emitter.write("first");
    emitter.shutdown();
    emitter.write("second");
    emitter.shutdown();

    assertEquals(List.of("write first"), decode().events());
  }

  @Test
  void writeFailuresAreLoggedOnce() {
    OutputStream broken = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("pipe closed");
      }
    };
    PipeEmitter emitter = emitter(broken, false);

    emitter.write("one");
    emitter.write("two");
    emitter.shutdown();

    assertEquals(1, appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).count());
  }

  @Test
  void redirectedStandardOutputIsCopiedIntoThePipe() {
    PrintStream originalOut = System.out;
    PipeEmitter emitter = emitter(pipe, true);
    try {
      emitter.install();
      System.out.println("captured by the emitter");
      emitter.uninstall();
    } finally {
      System.setOut(originalOut);
    }
    emitter.shutdown();

    assertSame(originalOut, System.out);
    List<String> events = decode().events();
    assertTrue(events.stream().allMatch(e -> e.startsWith("copy_stdout ")), events.toString());
    String copied = events.stream()
        .map(e -> e.substring("copy_stdout ".length()))
        .collect(Collectors.joining());
    assertEquals("captured by the emitter" + System.lineSeparator(), copied);
  }

  private PipeEmitter emitter(OutputStream out, boolean redirect) {
    return new PipeEmitter(out, format, new JacksonPayloadCodec(), metrics, redirect, Duration.ofSeconds(5));
  }

  private RecordingHandler decode() {
    MessageDispatcher dispatcher = new MessageDispatcher(format, new JacksonPayloadCodec(), metrics);
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);
    for (String line : pipe.toString(StandardCharsets.US_ASCII).split("\n")) {
      if (!line.isEmpty()) {
        dispatcher.dispatchLine(line);
      }
    }
    return handler;
  }

  private static EngineRecords.TestReport report(String when, String outcome) {
    return new EngineRecords.TestReport(TEST_ID, when, outcome, 0.1d, 1d, 1.1d, null, List.of(),
        null, null, null);
  }
}
