package ca.gc.cra.pulse.application.dispatch;

import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.port.PayloadCodec;
import ca.gc.cra.pulse.application.port.RunEventHandler;
import ca.gc.cra.pulse.domain.error.DecodeException;
import ca.gc.cra.pulse.domain.error.ProtocolViolationException;
import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.domain.protocol.Message;
import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.ConfigRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.SessionRepr;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.repr.WarningRepr;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.logging.Logs;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Routes reassembled engine output lines to registered {@link RunEventHandler}s.
 * <p><strong>Why:</strong> The engine's output interleaves framed protocol messages with raw text; handlers
 * want typed callbacks delivered in production order.</p>
 * <p><strong>Role:</strong> Application service between the line reassembler and the run observers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Recognise frames, decode their arguments lazily and bind them to a typed callback.</li>
 *   <li>Hold run-phase messages that overtake {@code start_run_phase} and replay them right after it.</li>
 *   <li>Isolate handler failures so one observer cannot stop delivery to the others.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; lines must be dispatched from one thread in arrival
 * order.</p>
 * <p><strong>Observability:</strong> Emits {@code dispatch.message.handled}, {@code dispatch.message.unknown},
 * {@code dispatch.decode.error}, {@code dispatch.handler.error} and {@code dispatch.holdback.queued}.</p>
 *
 * @since 0.1.0
 */
public final class MessageDispatcher {
  private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);
  private static final int LOG_LINE_BYTES = 512;

  /** Binds decoded arguments to a handler callback. */
  @FunctionalInterface
  interface Binder {
    Consumer<RunEventHandler> bind(MessageDispatcher dispatcher, List<Object> args);
  }

  private static final Map<MessageKind, Binder> BINDERS = new EnumMap<>(MessageKind.class);

  static {
    BINDERS.put(MessageKind.INIT, (d, a) -> {
      ConfigRepr config = arg(a, 0, ConfigRepr.class);
      return h -> h.onInit(config);
    });
    BINDERS.put(MessageKind.SESSION_START, (d, a) -> {
      SessionRepr session = arg(a, 0, SessionRepr.class);
      return h -> h.onSessionStart(session);
    });
    BINDERS.put(MessageKind.RUN_TEST_LOOP, (d, a) -> RunEventHandler::onRunTestLoop);
    BINDERS.put(MessageKind.COLLECTION_START, (d, a) -> RunEventHandler::onCollectionStart);
    BINDERS.put(MessageKind.COLLECT_REPORT, (d, a) -> {
      CollectReportRepr report = arg(a, 0, CollectReportRepr.class);
      return h -> h.onCollectReport(report);
    });
    BINDERS.put(MessageKind.DESELECT_TESTS, (d, a) -> {
      List<ItemRepr> items = itemList(a, 0);
      return h -> h.onDeselect(items);
    });
    BINDERS.put(MessageKind.COLLECTION_FINISH, (d, a) -> RunEventHandler::onCollectionFinish);
    BINDERS.put(MessageKind.START_RUN_PHASE, (d, a) -> RunEventHandler::onStartRunPhase);
    BINDERS.put(MessageKind.START_TEST, (d, a) -> {
      NodeId nodeId = d.nodeIdArg(a, 0);
      return h -> h.onStartTest(nodeId);
    });
    BINDERS.put(MessageKind.TEST_REPORT, (d, a) -> {
      TestReportRepr report = arg(a, 0, TestReportRepr.class);
      return h -> h.onTestReport(report);
    });
    BINDERS.put(MessageKind.END_TEST, (d, a) -> {
      NodeId nodeId = d.nodeIdArg(a, 0);
      return h -> h.onEndTest(nodeId);
    });
    BINDERS.put(MessageKind.WARNING_RECORDED, (d, a) -> {
      WarningRepr warning = arg(a, 0, WarningRepr.class);
      return h -> h.onWarning(warning);
    });
    BINDERS.put(MessageKind.INTERNAL_ERROR, (d, a) -> {
      String text = text(a, 0);
      return h -> h.onInternalError(text);
    });
    BINDERS.put(MessageKind.KEYBOARD_INTERRUPT, (d, a) -> {
      String text = text(a, 0);
      return h -> h.onKeyboardInterrupt(text);
    });
    BINDERS.put(MessageKind.SESSION_END, (d, a) -> {
      int status = arg(a, 0, Number.class).intValue();
      return h -> h.onSessionEnd(status);
    });
    BINDERS.put(MessageKind.UNCONFIGURE, (d, a) -> RunEventHandler::onUnconfigure);
    BINDERS.put(MessageKind.WRITE, (d, a) -> {
      String text = text(a, 0);
      return h -> h.onWrite(text);
    });
    BINDERS.put(MessageKind.WRITE_LINE, (d, a) -> {
      String text = text(a, 0);
      return h -> h.onWriteLine(text);
    });
    BINDERS.put(MessageKind.WRITE_SEP, (d, a) -> {
      String sep = text(a, 0);
      String title = text(a, 1);
      return h -> h.onWriteSep(sep, title);
    });
    BINDERS.put(MessageKind.REWRITE, (d, a) -> {
      String text = text(a, 0);
      return h -> h.onRewrite(text);
    });
    BINDERS.put(MessageKind.COPY_STDOUT, (d, a) -> {
      String text = text(a, 0);
      return h -> h.onCopyStdout(text);
    });
    BINDERS.put(MessageKind.COPY_STDERR, (d, a) -> {
      String text = text(a, 0);
      return h -> h.onCopyStderr(text);
    });
  }

  private record Registration(RunEventHandler handler, Set<MessageKind> kinds) {}

  private record HeldMessage(MessageKind kind, Consumer<RunEventHandler> call, String line) {}

  private final FrameFormat frameFormat;
  private final PayloadCodec codec;
  private final MetricsPort metrics;
  private final List<Registration> registrations = new ArrayList<>();
  private final Set<String> reportedNames = new HashSet<>();
  private final Deque<HeldMessage> held = new ArrayDeque<>();
  private boolean runPhaseConfirmed;

  /**
   * Creates a dispatcher.
   *
   * @param frameFormat sentinel framing shared with the emitter
   * @param codec payload codec; its captured root path binds node ids
   * @param metrics metrics sink
   */
  public MessageDispatcher(FrameFormat frameFormat, PayloadCodec codec, MetricsPort metrics) {
    this.frameFormat = Objects.requireNonNull(frameFormat, "frameFormat");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Registers a handler; its subscriptions are captured at registration.
   *
   * @param handler observer to add
   */
  public void addHandler(RunEventHandler handler) {
    Objects.requireNonNull(handler, "handler");
    Set<MessageKind> kinds = handler.subscriptions();
    Set<MessageKind> copy = kinds == null || kinds.isEmpty()
        ? EnumSet.noneOf(MessageKind.class)
        : EnumSet.copyOf(kinds);
    registrations.add(new Registration(handler, Collections.unmodifiableSet(copy)));
  }

  /**
   * Dispatches one reassembled line.
   *
   * @param line line without its terminator
   */
  public void dispatchLine(String line) {
    if (!frameFormat.isFrame(line)) {
      deliverOutput(line);
      return;
    }
    Message message = frameFormat.parse(line).orElse(null);
    if (message == null) {
      reportOnce("<empty>", "Frame without a message name");
      return;
    }
    MessageKind kind = message.kind().orElse(null);
    if (kind == null) {
      reportOnce(message.name(), "Unknown message name '" + message.name() + "'");
      return;
    }
    if (!hasSubscriber(kind)) {
      reportOnce(message.name(), "No handler subscribes to '" + message.name() + "'");
      beforeDelivery(kind);
      afterDelivery(kind);
      return;
    }
    Consumer<RunEventHandler> call = bind(kind, message, line);
    if (call == null) {
      return;
    }
    if (kind.runPhase() && !runPhaseConfirmed) {
      held.addLast(new HeldMessage(kind, call, line));
      metrics.increment("dispatch.holdback.queued");
      log.debug("Holding {} until the run phase starts ({} held)", kind.wireName(), held.size());
      return;
    }
    deliver(kind, call, line);
  }

  /** Discards, with a warning, anything still held at end of stream. */
  public void finish() {
    if (held.isEmpty()) {
      return;
    }
    log.warn("Discarding {} run-phase messages that never saw start_run_phase", held.size());
    for (HeldMessage message : held) {
      log.debug("Discarded held message: {}", Logs.truncate(message.line(), LOG_LINE_BYTES));
    }
    held.clear();
  }

  /**
   * Tells every handler that the run is over.
   *
   * @param result final run outcome
   */
  public void notifyRunFinished(RunResult result) {
    for (Registration registration : registrations) {
      try {
        registration.handler().onRunFinished(result);
      } catch (RuntimeException ex) {
        metrics.increment("dispatch.handler.error");
        log.error("Handler {} failed on run completion",
            registration.handler().getClass().getSimpleName(), ex);
      }
    }
  }

  /** Number of run-phase messages waiting for {@code start_run_phase}. */
  public int heldCount() {
    return held.size();
  }

  private void deliver(MessageKind kind, Consumer<RunEventHandler> call, String line) {
    beforeDelivery(kind);
    for (Registration registration : registrations) {
      if (!registration.kinds().contains(kind)) {
        continue;
      }
      try {
        call.accept(registration.handler());
      } catch (RuntimeException ex) {
        metrics.increment("dispatch.handler.error");
        log.error("Handler {} failed on message: {}",
            registration.handler().getClass().getSimpleName(),
            Logs.truncate(line, LOG_LINE_BYTES), ex);
      }
    }
    metrics.increment("dispatch.message.handled");
    afterDelivery(kind);
  }

  private void beforeDelivery(MessageKind kind) {
    if (kind == MessageKind.INIT
        || kind == MessageKind.SESSION_START
        || kind == MessageKind.COLLECTION_START) {
      runPhaseConfirmed = false;
    }
  }

  private void afterDelivery(MessageKind kind) {
    if (kind == MessageKind.START_RUN_PHASE) {
      runPhaseConfirmed = true;
      replayHeld();
    }
  }

  private void replayHeld() {
    if (held.isEmpty()) {
      return;
    }
    log.debug("Replaying {} held run-phase messages", held.size());
    while (!held.isEmpty() && runPhaseConfirmed) {
      HeldMessage message = held.pollFirst();
      deliver(message.kind(), message.call(), message.line());
    }
  }

  private void deliverOutput(String line) {
    for (Registration registration : registrations) {
      try {
        registration.handler().onOutputLine(line);
      } catch (RuntimeException ex) {
        metrics.increment("dispatch.handler.error");
        log.error("Handler {} failed on output line: {}",
            registration.handler().getClass().getSimpleName(),
            Logs.truncate(line, LOG_LINE_BYTES), ex);
      }
    }
  }

  private Consumer<RunEventHandler> bind(MessageKind kind, Message message, String line) {
    if (message.args().size() != kind.arity()) {
      metrics.increment("dispatch.decode.error");
      log.warn("Protocol violation: {} expects {} arguments but got {}: {}",
          kind.wireName(), kind.arity(), message.args().size(), Logs.truncate(line, LOG_LINE_BYTES));
      return null;
    }
    List<Object> decoded = new ArrayList<>(message.args().size());
    for (String token : message.args()) {
      try {
        decoded.add(codec.decode(token));
      } catch (DecodeException ex) {
        metrics.increment("dispatch.decode.error");
        log.warn("Skipping {} message, {}: {}{}", kind.wireName(), ex.getMessage(),
            Logs.truncate(line, LOG_LINE_BYTES), Logs.excerpt(ex.before(), ex.after()));
        return null;
      }
    }
    try {
      return BINDERS.get(kind).bind(this, decoded);
    } catch (ProtocolViolationException ex) {
      metrics.increment("dispatch.decode.error");
      log.warn("Protocol violation in {}: {}", kind.wireName(), ex.getMessage());
      return null;
    }
  }

  private boolean hasSubscriber(MessageKind kind) {
    for (Registration registration : registrations) {
      if (registration.kinds().contains(kind)) {
        return true;
      }
    }
    return false;
  }

  private void reportOnce(String name, String message) {
    metrics.increment("dispatch.message.unknown");
    if (reportedNames.add(name)) {
      log.warn("Protocol violation: {}; ignoring further occurrences", message);
    }
  }

  private NodeId nodeIdArg(List<Object> args, int index) {
    Object value = args.get(index);
    if (value instanceof NodeId nodeId) {
      return nodeId;
    }
    if (value instanceof String text) {
      return NodeId.of(text, codec.rootPath().orElse(null));
    }
    throw new ProtocolViolationException(
        "argument " + index + " must be a node id but was " + typeOf(value));
  }

  private static <T> T arg(List<Object> args, int index, Class<T> type) {
    Object value = args.get(index);
    if (!type.isInstance(value)) {
      throw new ProtocolViolationException("argument " + index + " must be "
          + type.getSimpleName() + " but was " + typeOf(value));
    }
    return type.cast(value);
  }

  private static String text(List<Object> args, int index) {
    Object value = args.get(index);
    return value == null ? "" : arg(args, index, String.class);
  }

  private static List<ItemRepr> itemList(List<Object> args, int index) {
    List<?> raw = arg(args, index, List.class);
    List<ItemRepr> items = new ArrayList<>(raw.size());
    for (Object element : raw) {
      if (!(element instanceof ItemRepr item)) {
        throw new ProtocolViolationException(
            "argument " + index + " must only contain items but had " + typeOf(element));
      }
      items.add(item);
    }
    return List.copyOf(items);
  }

  private static String typeOf(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
