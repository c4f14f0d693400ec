package ca.gc.cra.pulse.application.pipeline;

import ca.gc.cra.pulse.application.dispatch.MessageDispatcher;
import ca.gc.cra.pulse.application.port.EngineProcess;
import ca.gc.cra.pulse.application.port.MetricsPort;
import ca.gc.cra.pulse.application.port.RunEventHandler;
import ca.gc.cra.pulse.application.port.TestEngineLauncher;
import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.state.RunResult;
import ca.gc.cra.pulse.infrastructure.stream.LineReassembler;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Consumes one engine run: reads its combined output in fixed-size chunks,
 * reassembles lines and dispatches them.
 * <p><strong>Why:</strong> The stream may close early or the engine may die; the front end still needs one
 * definitive end-of-run notification with the exit classification.</p>
 * <p><strong>Role:</strong> Application pipeline tying the engine process, the {@link LineReassembler} and
 * the {@link MessageDispatcher} together.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the blocking read, reassemble and dispatch loop on the calling thread.</li>
 *   <li>Wait for the exit status and classify it as a {@link RunResult}.</li>
 *   <li>Run the final bookkeeping exactly once, even after cancellation.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #run(EngineProcess)} is single-threaded; {@link #cancel()} may
 * be called from any thread.</p>
 * <p><strong>Observability:</strong> MDC key {@code run}; metrics {@code session.bytes.read},
 * {@code session.lines} and {@code session.line.dropped}.</p>
 *
 * @since 0.1.0
 */
public final class TestRunSession {
  private static final Logger log = LoggerFactory.getLogger(TestRunSession.class);
  private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();

  /** Exit code recorded when the wait for the engine is interrupted or never ends. */
  public static final int EXIT_UNKNOWN = -1;

  /** Default wait for the engine to exit once its output has closed. */
  public static final Duration DEFAULT_EXIT_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration DESTROY_GRACE = Duration.ofSeconds(5);

  private final MessageDispatcher dispatcher;
  private final MetricsPort metrics;
  private final int chunkSize;
  private final Duration exitTimeout;
  private final AtomicReference<EngineProcess> running = new AtomicReference<>();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final SessionEndTracker sessionEnd = new SessionEndTracker();

  /**
   * Creates a session.
   *
   * @param dispatcher dispatcher with the run's handlers registered
   * @param metrics metrics sink
   * @param chunkSize read size in bytes
   */
  public TestRunSession(MessageDispatcher dispatcher, MetricsPort metrics, int chunkSize) {
    this(dispatcher, metrics, chunkSize, DEFAULT_EXIT_TIMEOUT);
  }

  /**
   * Creates a session with a custom exit wait.
   *
   * @param dispatcher dispatcher with the run's handlers registered
   * @param metrics metrics sink
   * @param chunkSize read size in bytes
   * @param exitTimeout how long to wait for the engine to exit after its output closes
   */
  public TestRunSession(MessageDispatcher dispatcher, MetricsPort metrics, int chunkSize,
      Duration exitTimeout) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    this.chunkSize = chunkSize;
    this.exitTimeout = Objects.requireNonNull(exitTimeout, "exitTimeout");
    dispatcher.addHandler(sessionEnd);
  }

  /**
   * Launches the engine and consumes its output.
   *
   * @param launcher process launcher
   * @param command engine command line
   * @param workDir working directory
   * @param environment extra environment variables
   * @return run outcome
   * @throws IOException if the engine cannot be started
   */
  public RunResult launchAndRun(TestEngineLauncher launcher, List<String> command, Path workDir,
      Map<String, String> environment) throws IOException {
    EngineProcess process = launcher.launch(command, workDir, environment);
    return run(process);
  }

  /**
   * Consumes an already started engine until its output ends.
   *
   * @param process engine process
   * @return run outcome
   */
  public RunResult run(EngineProcess process) {
    Objects.requireNonNull(process, "process");
    if (!running.compareAndSet(null, process)) {
      throw new IllegalStateException("A run is already in progress");
    }
    cancelled.set(false);
    sessionEnd.seen = false;
    MDC.put("run", "run-" + RUN_SEQUENCE.incrementAndGet());
    AtomicBoolean finalized = new AtomicBoolean();
    try {
      log.info("Consuming output of {}", process.describe());
      pump(process.output());
      int exitCode = awaitExit(process);
      RunResult result = RunResult.of(exitCode, sessionEnd.seen);
      finalizeRun(finalized, result);
      return result;
    } finally {
      if (!finalized.get()) {
        finalizeRun(finalized, RunResult.of(EXIT_UNKNOWN, sessionEnd.seen));
      }
      running.set(null);
      MDC.remove("run");
    }
  }

  /** Destroys the running engine; the read loop then ends at end of stream. */
  public void cancel() {
    EngineProcess process = running.get();
    if (process != null && cancelled.compareAndSet(false, true)) {
      log.info("Cancelling {}", process.describe());
      process.destroy();
    }
  }

  /** Whether a run is currently being consumed. */
  public boolean isRunning() {
    return running.get() != null;
  }

  public Optional<EngineProcess> currentProcess() {
    return Optional.ofNullable(running.get());
  }

  private void pump(InputStream in) {
    LineReassembler reassembler = new LineReassembler();
    byte[] chunk = new byte[chunkSize];
    long lines = 0;
    try {
      int n;
      while ((n = in.read(chunk)) != -1) {
        if (n == 0) {
          continue;
        }
        metrics.observe("session.bytes.read", n);
        long droppedBefore = reassembler.droppedLines();
        for (String line : reassembler.feed(chunk, n)) {
          dispatcher.dispatchLine(line);
          lines++;
        }
        for (long i = droppedBefore; i < reassembler.droppedLines(); i++) {
          log.warn("Dropped engine output line longer than {} bytes", LineReassembler.DEFAULT_MAX_LINE_BYTES);
          metrics.increment("session.line.dropped");
        }
      }
    } catch (IOException ex) {
      if (cancelled.get()) {
        log.debug("Output stream closed after cancellation: {}", ex.getMessage());
      } else {
        log.warn("Engine output stream failed; treating as end of stream", ex);
      }
    }
    Optional<String> tail = reassembler.finish();
    if (tail.isPresent()) {
      dispatcher.dispatchLine(tail.get());
      lines++;
    }
    metrics.observe("session.lines", lines);
    log.debug("Engine output ended after {} lines", lines);
  }

  private int awaitExit(EngineProcess process) {
    try {
      if (!process.waitFor(exitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("{} still running {} ms after its output closed; destroying it",
            process.describe(), exitTimeout.toMillis());
        process.destroy();
        if (!process.waitFor(DESTROY_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          log.error("{} did not exit after destroy", process.describe());
          return EXIT_UNKNOWN;
        }
      }
      return process.waitFor();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for {} to exit", process.describe());
      process.destroy();
      return EXIT_UNKNOWN;
    }
  }

  private void finalizeRun(AtomicBoolean finalized, RunResult result) {
    if (!finalized.compareAndSet(false, true)) {
      return;
    }
    dispatcher.finish();
    result.failure().ifPresentOrElse(
        ex -> log.error("Engine run failed: {}", ex.getMessage()),
        () -> log.info("Engine run finished with exit code {}", result.exitCode()));
    dispatcher.notifyRunFinished(result);
  }

  private static final class SessionEndTracker implements RunEventHandler {
    private static final Set<MessageKind> KINDS = EnumSet.of(MessageKind.SESSION_END);

    private boolean seen;

    @Override
    public Set<MessageKind> subscriptions() {
      return KINDS;
    }

    @Override
    public void onSessionEnd(int exitStatus) {
      seen = true;
    }
  }
}
