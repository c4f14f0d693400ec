package ca.gc.cra.pulse.application.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pulse.application.port.RunEventHandler;
import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.domain.protocol.Message;
import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.Phase;
import ca.gc.cra.pulse.domain.repr.ReportOutcome;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.infrastructure.codec.JacksonPayloadCodec;
import ca.gc.cra.pulse.support.RecordingHandler;
import ca.gc.cra.pulse.support.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MessageDispatcherTest {
  private static final NodeId TEST_A = NodeId.of("tests/test_a.py::test_one");

  private final FrameFormat format = FrameFormat.defaults();
  private final JacksonPayloadCodec codec = new JacksonPayloadCodec();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(MessageDispatcher.class);
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
  void passesPlainLinesToEveryHandler() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler first = new RecordingHandler();
    RecordingHandler second = new RecordingHandler(EnumSet.of(MessageKind.WRITE));
    dispatcher.addHandler(first);
    dispatcher.addHandler(second);

    dispatcher.dispatchLine("plain output from a test");
    dispatcher.dispatchLine(format.sentinel() + "notaframe");

    assertEquals(List.of("plain output from a test", format.sentinel() + "notaframe"), first.outputLines());
    assertEquals(first.outputLines(), second.outputLines());
    assertTrue(first.events().isEmpty());
  }

  @Test
  void decodesFramesIntoTypedCallbacks() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);

    dispatcher.dispatchLine(frame(MessageKind.WRITE_SEP, "=", "test session starts"));
    dispatcher.dispatchLine(frame(MessageKind.SESSION_END, 1));

    assertEquals(List.of("write_sep = test session starts", "session_end 1"), handler.events());
    assertEquals(2, metrics.count("dispatch.message.handled"));
  }

  @Test
  void runPhaseMessagesAreHeldUntilRunPhaseStarts() {
    List<String> inOrder = replay(List.of(
        frame(MessageKind.START_RUN_PHASE),
        frame(MessageKind.START_TEST, TEST_A),
        frame(MessageKind.TEST_REPORT, TestReportRepr.of(TEST_A, Phase.SETUP, ReportOutcome.PASSED)),
        frame(MessageKind.END_TEST, TEST_A)));
    List<String> overtaken = replay(List.of(
        frame(MessageKind.START_TEST, TEST_A),
        frame(MessageKind.TEST_REPORT, TestReportRepr.of(TEST_A, Phase.SETUP, ReportOutcome.PASSED)),
        frame(MessageKind.START_RUN_PHASE),
        frame(MessageKind.END_TEST, TEST_A)));

    assertEquals(inOrder, overtaken);
    assertEquals(List.of(
        "start_run_phase",
        "start_test " + TEST_A,
        "test_report " + TEST_A + " setup",
        "end_test " + TEST_A), overtaken);
  }

  @Test
  void newCollectionRequiresAnotherRunPhaseStart() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);

    dispatcher.dispatchLine(frame(MessageKind.START_RUN_PHASE));
    dispatcher.dispatchLine(frame(MessageKind.COLLECTION_START));
    dispatcher.dispatchLine(frame(MessageKind.START_TEST, TEST_A));

    assertEquals(1, dispatcher.heldCount());
    assertEquals(1, metrics.count("dispatch.holdback.queued"));
  }

  @Test
  void finishDiscardsHeldMessagesWithWarning() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);
    dispatcher.dispatchLine(frame(MessageKind.START_TEST, TEST_A));

    dispatcher.finish();

    assertEquals(0, dispatcher.heldCount());
    assertTrue(handler.events().isEmpty());
    assertTrue(warned("Discarding 1 run-phase messages"));
  }

  @Test
  void unknownMessageNameIsReportedOnce() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);

    dispatcher.dispatchLine(format.sentinel() + " mystery_message 00");
    dispatcher.dispatchLine(format.sentinel() + " mystery_message 00");

    long warnings = appender.list.stream()
        .filter(e -> e.getFormattedMessage().contains("mystery_message"))
        .count();
    assertEquals(1, warnings);
    assertEquals(2, metrics.count("dispatch.message.unknown"));
    assertTrue(handler.events().isEmpty());
    assertTrue(handler.outputLines().isEmpty());
  }

  @Test
  void messageWithoutSubscriberIsReportedOnce() {
    MessageDispatcher dispatcher = dispatcher();
    dispatcher.addHandler(new RecordingHandler(EnumSet.of(MessageKind.WRITE)));

    dispatcher.dispatchLine(frame(MessageKind.RUN_TEST_LOOP));
    dispatcher.dispatchLine(frame(MessageKind.RUN_TEST_LOOP));

    assertEquals(1, appender.list.stream()
        .filter(e -> e.getFormattedMessage().contains("No handler subscribes to 'runtestloop'"))
        .count());
  }

  @Test
  void wrongArityIsSkipped() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);

    dispatcher.dispatchLine(format.frame(new Message("write_sep", List.of(codec.encode("=")))));
    dispatcher.dispatchLine(frame(MessageKind.WRITE, "after"));

    assertEquals(List.of("write after"), handler.events());
    assertEquals(1, metrics.count("dispatch.decode.error"));
    assertTrue(warned("write_sep expects 2 arguments but got 1"));
  }

  @Test
  void corruptPayloadIsSkippedAndLogged() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);

    dispatcher.dispatchLine(format.frame(new Message("write", List.of("22zz22"))));
    dispatcher.dispatchLine(frame(MessageKind.WRITE, "next"));

    assertEquals(List.of("write next"), handler.events());
    assertEquals(1, metrics.count("dispatch.decode.error"));
    assertTrue(warned("Non-hex encoded data at offset 2"));
  }

  @Test
  void wrongArgumentTypeIsSkipped() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);

    dispatcher.dispatchLine(frame(MessageKind.SESSION_END, "not a number"));

    assertTrue(handler.events().isEmpty());
    assertEquals(1, metrics.count("dispatch.decode.error"));
  }

  @Test
  void failingHandlerDoesNotStopOthers() {
    MessageDispatcher dispatcher = dispatcher();
    List<String> seen = new ArrayList<>();
    dispatcher.addHandler(new RunEventHandler() {
      @Override
      public void onWrite(String text) {
        throw new IllegalStateException("observer broke");
      }
    });
    dispatcher.addHandler(new RunEventHandler() {
      @Override
      public void onWrite(String text) {
        seen.add(text);
      }
    });

    dispatcher.dispatchLine(frame(MessageKind.WRITE, "payload"));

    assertEquals(List.of("payload"), seen);
    assertEquals(1, metrics.count("dispatch.handler.error"));
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR));
  }

  @Test
  void subscriptionsLimitDelivery() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler writesOnly = new RecordingHandler(EnumSet.of(MessageKind.WRITE));
    RecordingHandler everything = new RecordingHandler();
    dispatcher.addHandler(writesOnly);
    dispatcher.addHandler(everything);

    dispatcher.dispatchLine(frame(MessageKind.WRITE, "w"));
    dispatcher.dispatchLine(frame(MessageKind.UNCONFIGURE));

    assertEquals(List.of("write w"), writesOnly.events());
    assertEquals(List.of("write w", "unconfigure"), everything.events());
  }

  @Test
  void runFinishedReachesEveryHandler() {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler first = new RecordingHandler();
    RecordingHandler second = new RecordingHandler(EnumSet.noneOf(MessageKind.class));
    dispatcher.addHandler(first);
    dispatcher.addHandler(second);

    dispatcher.notifyRunFinished(RunResult.of(0, true));

    assertEquals(1, first.results().size());
    assertEquals(1, second.results().size());
  }

  private List<String> replay(List<String> lines) {
    MessageDispatcher dispatcher = dispatcher();
    RecordingHandler handler = new RecordingHandler();
    dispatcher.addHandler(handler);
    lines.forEach(dispatcher::dispatchLine);
    return handler.events();
  }

  private MessageDispatcher dispatcher() {
    return new MessageDispatcher(format, codec, metrics);
  }

  private String frame(MessageKind kind, Object... args) {
    List<String> tokens = new ArrayList<>();
    for (Object arg : args) {
      tokens.add(codec.encode(arg));
    }
    return format.frame(Message.of(kind, tokens));
  }

  private boolean warned(String fragment) {
    return appender.list.stream()
        .anyMatch(e -> e.getLevel() == Level.WARN && e.getFormattedMessage().contains(fragment));
  }
}
