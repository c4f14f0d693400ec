package ca.gc.cra.pulse.application.emit;

import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.port.PayloadCodec;
import ca.gc.cra.pulse.application.port.engine.EngineCollectReport;
import ca.gc.cra.pulse.application.port.engine.EngineConfig;
import ca.gc.cra.pulse.application.port.engine.EngineLifecycleListener;
import ca.gc.cra.pulse.application.port.engine.EngineNode;
import ca.gc.cra.pulse.application.port.engine.EngineSession;
import ca.gc.cra.pulse.application.port.engine.EngineTestReport;
import ca.gc.cra.pulse.application.port.engine.EngineWarning;
import ca.gc.cra.pulse.domain.protocol.FrameFormat;
import ca.gc.cra.pulse.domain.protocol.Message;
import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.infrastructure.exec.ExecutorFactories;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Engine-side producer that turns lifecycle callbacks into framed protocol lines on
 * the inherited output channel.
 * <p><strong>Why:</strong> Callbacks arrive on the engine's main thread and, during parallel collection, an
 * auxiliary thread; the channel must still carry whole lines in callback order.</p>
 * <p><strong>Role:</strong> Implements {@link EngineLifecycleListener}; the engine registers it as a plugin.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Encode arguments and enqueue framed lines on one {@link LinkedBlockingQueue}.</li>
 *   <li>Drain the queue from exactly one writer thread ({@code pulse-pipe-writer}), flushing per line.</li>
 *   <li>Infer the start of the run phase, drop duplicate collect reports and repeated warnings.</li>
 *   <li>Optionally redirect {@code System.out}/{@code System.err} into copy messages.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Callbacks may be invoked from several threads; phase-sensitive sends are
 * serialised on an internal lock.</p>
 * <p><strong>Observability:</strong> Metrics {@code emit.queue.enqueued}, {@code emit.queue.depth} and
 * {@code emit.collect.duplicateDropped}; MDC {@code pipeline=emit} on the writer thread.</p>
 *
 * @since 0.1.0
 */
public final class PipeEmitter implements EngineLifecycleListener {
  private static final Logger log = LoggerFactory.getLogger(PipeEmitter.class);

  /** Environment variable that disables stdio redirection. */
  public static final String DEBUG_ENV = "PULSE_DEBUG";
  static final String WRITER_THREAD = "pulse-pipe-writer";
  static final String AUX_COLLECTION_THREAD = "pulse-par-collect";
  private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
  private static final byte[] NEWLINE = {'\n'};

  private record QueueEntry(String line) {}

  private static final QueueEntry STOP = new QueueEntry(null);

  private final OutputStream pipe;
  private final FrameFormat frameFormat;
  private final PayloadCodec codec;
  private final MetricsPort metrics;
  private final boolean redirectStdio;
  private final Duration shutdownTimeout;
  private final BlockingQueue<QueueEntry> queue = new LinkedBlockingQueue<>();
  private final Set<String> seenWarnings = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();
  private final AtomicBoolean writeFailureLogged = new AtomicBoolean();
  private final Object phaseLock = new Object();

  private volatile Thread writer;
  private volatile Thread auxiliaryCollector;
  private volatile boolean auxiliaryJoinable;
  private EmitterPhase phase = EmitterPhase.INIT;
  private boolean collectionActive;
  private PrintStream savedOut;
  private PrintStream savedErr;

  /**
   * Creates an emitter writing to the given channel.
   *
   * @param pipe output channel shared with engine passthrough text
   * @param frameFormat sentinel framing
   * @param codec payload codec
   * @param metrics metrics sink
   * @param redirectStdio whether {@link #install()} redirects {@code System.out}/{@code System.err}
   */
  public PipeEmitter(OutputStream pipe, FrameFormat frameFormat, PayloadCodec codec, MetricsPort metrics,
      boolean redirectStdio) {
    this(pipe, frameFormat, codec, metrics, redirectStdio, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  PipeEmitter(OutputStream pipe, FrameFormat frameFormat, PayloadCodec codec, MetricsPort metrics,
      boolean redirectStdio, Duration shutdownTimeout) {
    this.pipe = Objects.requireNonNull(pipe, "pipe");
    this.frameFormat = Objects.requireNonNull(frameFormat, "frameFormat");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.redirectStdio = redirectStdio;
    this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
  }

  /**
   * Creates an emitter on the process's real standard output.
   *
   * <p>Redirection is disabled when {@value #DEBUG_ENV} is set.</p>
   *
   * @param frameFormat sentinel framing
   * @param codec payload codec
   * @param metrics metrics sink
   * @return emitter, not yet installed
   */
  @SuppressFBWarnings(value = "OBL_UNSATISFIED_OBLIGATION",
      justification = "Standard output stays open for the life of the process")
  public static PipeEmitter forStandardOutput(FrameFormat frameFormat, PayloadCodec codec,
      MetricsPort metrics) {
    boolean redirect = System.getenv(DEBUG_ENV) == null;
    return new PipeEmitter(new FileOutputStream(FileDescriptor.out), frameFormat, codec, metrics, redirect);
  }

  /** Starts the writer thread; idempotent. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    Thread thread = ExecutorFactories.newNamedThread(WRITER_THREAD, this::drainQueue);
    writer = thread;
    thread.start();
    log.debug("Pipe writer started");
  }

  /** Starts the writer and, unless disabled, redirects {@code System.out}/{@code System.err}. */
  public synchronized void install() {
    start();
    if (!redirectStdio || savedOut != null) {
      return;
    }
    savedOut = System.out;
    savedErr = System.err;
    System.setOut(new PrintStream(
        new PipeRedirectStream(this, MessageKind.COPY_STDOUT, savedOut), true, StandardCharsets.UTF_8));
    System.setErr(new PrintStream(
        new PipeRedirectStream(this, MessageKind.COPY_STDERR, savedErr), true, StandardCharsets.UTF_8));
    log.debug("Redirected standard streams into the pipe");
  }

  /** Restores the standard streams replaced by {@link #install()}. */
  public synchronized void uninstall() {
    if (savedOut == null) {
      return;
    }
    System.out.flush();
    System.err.flush();
    System.setOut(savedOut);
    System.setErr(savedErr);
    savedOut = null;
    savedErr = null;
  }

  /**
   * Runs a collection pass on the auxiliary collection thread.
   *
   * @param collection work that will call the collection callbacks
   */
  public void startAuxiliaryCollection(Runnable collection) {
    Objects.requireNonNull(collection, "collection");
    Thread thread = ExecutorFactories.newNamedThread(AUX_COLLECTION_THREAD, collection);
    auxiliaryJoinable = false;
    auxiliaryCollector = thread;
    thread.start();
  }

  /** Current inferred phase. */
  public EmitterPhase phase() {
    synchronized (phaseLock) {
      return phase;
    }
  }

  @Override
  public void configured(EngineConfig config) {
    synchronized (phaseLock) {
      phase = EmitterPhase.INIT;
      collectionActive = false;
    }
    send(MessageKind.INIT, config);
  }

  @Override
  public void sessionStart(EngineSession session) {
    send(MessageKind.SESSION_START, session);
  }

  @Override
  public void runTestLoop() {
    send(MessageKind.RUN_TEST_LOOP);
  }

  @Override
  public void collectionStart() {
    synchronized (phaseLock) {
      phase = EmitterPhase.COLLECTING;
      collectionActive = true;
      send(MessageKind.COLLECTION_START);
    }
  }

  @Override
  public void collectReport(EngineCollectReport report) {
    boolean active;
    synchronized (phaseLock) {
      active = collectionActive;
    }
    if (!report.primary() || !active) {
      metrics.increment("emit.collect.duplicateDropped");
      log.debug("Dropping duplicate collect report for {}", report.nodeId());
      return;
    }
    send(MessageKind.COLLECT_REPORT, report);
  }

  @Override
  public void deselected(List<EngineNode> items) {
    send(MessageKind.DESELECT_TESTS, List.copyOf(items));
  }

  @Override
  public void collectionFinish() {
    synchronized (phaseLock) {
      collectionActive = false;
      send(MessageKind.COLLECTION_FINISH);
    }
    if (Thread.currentThread() == auxiliaryCollector) {
      auxiliaryJoinable = true;
    }
  }

  @Override
  public void testStart(String nodeId) {
    joinAuxiliaryCollection();
    synchronized (phaseLock) {
      if (phase != EmitterPhase.RUNNING && !collectionActive) {
        phase = EmitterPhase.RUNNING;
        send(MessageKind.START_RUN_PHASE);
      }
      send(MessageKind.START_TEST, nodeId(nodeId));
    }
  }

  @Override
  public void testReport(EngineTestReport report) {
    send(MessageKind.TEST_REPORT, report);
  }

  @Override
  public void testFinish(String nodeId) {
    send(MessageKind.END_TEST, nodeId(nodeId));
  }

  @Override
  public void warningRecorded(EngineWarning warning) {
    String key = String.join("\u0000",
        String.valueOf(warning.message()),
        String.valueOf(warning.when()),
        String.valueOf(warning.nodeId()),
        String.valueOf(warning.filename()),
        String.valueOf(warning.lineNumber()),
        String.valueOf(warning.function()));
    if (!seenWarnings.add(key)) {
      log.debug("Suppressing repeated warning: {}", warning.message());
      return;
    }
    send(MessageKind.WARNING_RECORDED, warning);
  }

  @Override
  public void internalError(String text) {
    send(MessageKind.INTERNAL_ERROR, text);
  }

  @Override
  public void keyboardInterrupt(String text) {
    send(MessageKind.KEYBOARD_INTERRUPT, text);
  }

  @Override
  public void sessionFinish(int exitStatus) {
    joinAuxiliaryCollection();
    synchronized (phaseLock) {
      phase = EmitterPhase.DONE;
    }
    send(MessageKind.SESSION_END, exitStatus);
  }

  @Override
  public void unconfigure() {
    joinAuxiliaryCollection();
    send(MessageKind.UNCONFIGURE);
    uninstall();
    shutdown();
  }

  /** Forwards terminal-writer text. */
  public void write(String text) {
    send(MessageKind.WRITE, text);
  }

  public void writeLine(String line) {
    send(MessageKind.WRITE_LINE, line);
  }

  public void writeSep(String sep, String title) {
    send(MessageKind.WRITE_SEP, sep, title);
  }

  public void rewrite(String line) {
    send(MessageKind.REWRITE, line);
  }

  /**
   * Stops the writer after everything already queued has been written.
   *
   * <p>Waits up to the shutdown timeout; a writer still busy after that is logged and left to finish.</p>
   */
  public void shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    Thread thread = writer;
    if (thread == null) {
      return;
    }
    queue.add(STOP);
    try {
      thread.join(shutdownTimeout.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the pipe writer to drain");
      return;
    }
    if (thread.isAlive()) {
      log.warn("Pipe writer still busy after {} ms with {} lines queued",
          shutdownTimeout.toMillis(), queue.size());
    }
  }

  void copy(MessageKind kind, String text) {
    send(kind, text);
  }

  boolean isWriterThread() {
    return Thread.currentThread() == writer;
  }

  private void send(MessageKind kind, Object... args) {
    if (stopped.get()) {
      if (kind != MessageKind.COPY_STDOUT && kind != MessageKind.COPY_STDERR) {
        log.debug("Emitter stopped; dropping {}", kind.wireName());
      }
      return;
    }
    List<String> encoded = new ArrayList<>(args.length);
    for (Object arg : Arrays.asList(args)) {
      encoded.add(codec.encode(arg));
    }
    String line = frameFormat.frame(Message.of(kind, encoded));
    queue.add(new QueueEntry(line));
    metrics.increment("emit.queue.enqueued");
    start();
  }

  private void drainQueue() {
    MDC.put("pipeline", "emit");
    try {
      while (true) {
        QueueEntry entry = queue.take();
        if (entry == STOP) {
          break;
        }
        metrics.observe("emit.queue.depth", queue.size());
        writeToPipe(entry.line());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Pipe writer interrupted with {} lines queued", queue.size());
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void writeToPipe(String line) {
    try {
      pipe.write(line.getBytes(StandardCharsets.US_ASCII));
      pipe.write(NEWLINE);
      pipe.flush();
    } catch (IOException ex) {
      if (writeFailureLogged.compareAndSet(false, true)) {
        log.error("Failed to write to the output channel; further failures are not logged", ex);
      }
    }
  }

  private void joinAuxiliaryCollection() {
    Thread thread = auxiliaryCollector;
    if (thread == null || thread == Thread.currentThread()) {
      return;
    }
    try {
      thread.join();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while joining the auxiliary collection thread");
      return;
    }
    if (!auxiliaryJoinable) {
      log.debug("Auxiliary collection ended without finishing collection");
    }
    auxiliaryCollector = null;
  }

  private static NodeId nodeId(String raw) {
    return NodeId.of(NodeId.clean(raw));
  }
}
