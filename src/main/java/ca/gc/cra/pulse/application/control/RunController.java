package ca.gc.cra.pulse.application.control;

import ca.gc.cra.pulse.application.port.ClockPort;
import ca.gc.cra.pulse.application.port.RunEventHandler;
import ca.gc.cra.pulse.application.progress.ProgressGrouper;
import ca.gc.cra.pulse.application.state.TestRecord;
import ca.gc.cra.pulse.application.state.TestStateAggregator;
import ca.gc.cra.pulse.domain.error.ChildProcessException;
import ca.gc.cra.pulse.domain.progress.ProgressLayout;
import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.ConfigRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.ReportOutcome;
import ca.gc.cra.pulse.domain.repr.SessionRepr;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.repr.WarningRepr;
import ca.gc.cra.pulse.domain.state.CollectionUpdate;
import ca.gc.cra.pulse.domain.state.IndicatorStyle;
import ca.gc.cra.pulse.domain.state.RunResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Drives the {@link TestStateAggregator} from dispatched protocol events and keeps the
 * run-level view: phase timings, progress layout, failing and running tests.
 * <p><strong>Why:</strong> Renderers need a single owner that knows which phase the run is in and when the
 * layout must be recomputed.</p>
 * <p><strong>Role:</strong> {@link RunEventHandler} registered on the dispatcher; read by front ends.</p>
 * <p><strong>Thread-safety:</strong> Confined to the dispatching thread, except {@link #resize(int, int)} which
 * callers must serialise with dispatch.</p>
 *
 * @since 0.1.0
 */
public final class RunController implements RunEventHandler {
  private static final Logger log = LoggerFactory.getLogger(RunController.class);

  static final String INIT_PHASE = "Init phase";
  static final String COLLECTION = "Collection";
  static final String EXECUTION = "Execution";

  private static final Set<MessageKind> SUBSCRIPTIONS = EnumSet.complementOf(EnumSet.of(
      MessageKind.WRITE, MessageKind.WRITE_LINE, MessageKind.WRITE_SEP, MessageKind.REWRITE,
      MessageKind.COPY_STDOUT, MessageKind.COPY_STDERR));

  private final TestStateAggregator state;
  private final ProgressGrouper grouper;
  private final ClockPort clock;
  private final RunSummaryFormatter summaryFormatter;
  private final Set<NodeId> failingTests = new LinkedHashSet<>();
  private final Set<NodeId> runningTests = new LinkedHashSet<>();
  private final List<WarningRepr> warnings = new ArrayList<>();
  private final List<String> internalErrors = new ArrayList<>();

  private TimeStats timeStats;
  private ProgressLayout layout = ProgressLayout.empty();
  private Set<NodeId> selection = Set.of();
  private int width;
  private int height;
  private Path rootPath;
  private String collectionProgress = "";
  private int peakRunning;
  private boolean interrupted;
  private Integer sessionExitStatus;

  /**
   * Creates a controller.
   *
   * @param state aggregator to drive
   * @param grouper progress layout algorithm
   * @param clock time source for phase timings
   * @param style indicator style for summaries
   * @param width initial surface width
   * @param height initial surface height
   */
  public RunController(TestStateAggregator state, ProgressGrouper grouper, ClockPort clock,
      IndicatorStyle style, int width, int height) {
    this.state = Objects.requireNonNull(state, "state");
    this.grouper = Objects.requireNonNull(grouper, "grouper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.summaryFormatter = new RunSummaryFormatter(style);
    this.timeStats = new TimeStats(clock);
    this.width = width;
    this.height = height;
  }

  /**
   * Prepares for a new run, full or partial.
   *
   * @param rerun node ids to rerun; empty for a full run
   */
  public void startRun(Set<NodeId> rerun) {
    selection = rerun == null ? Set.of() : Set.copyOf(rerun);
    state.prepareForRun(selection);
    if (!selection.isEmpty()) {
      state.parkAndReset(selection);
      failingTests.removeAll(selection);
    } else {
      failingTests.clear();
      layout = ProgressLayout.empty();
    }
    runningTests.clear();
    warnings.clear();
    internalErrors.clear();
    peakRunning = 0;
    interrupted = false;
    sessionExitStatus = null;
    collectionProgress = "";
    timeStats = new TimeStats(clock);
    log.info("Starting {} run", selection.isEmpty() ? "full" : "partial (" + selection.size() + " tests)");
  }

  /**
   * Recomputes the progress layout for a new surface size.
   *
   * @param newWidth surface width
   * @param newHeight surface height
   */
  public void resize(int newWidth, int newHeight) {
    this.width = newWidth;
    this.height = newHeight;
    if (!state.items().isEmpty()) {
      layout = grouper.layout(state.items(), width, height);
    }
  }

  @Override
  public Set<MessageKind> subscriptions() {
    return SUBSCRIPTIONS;
  }

  @Override
  public void onInit(ConfigRepr config) {
    rootPath = config.rootPath();
    log.debug("Engine configured with root {}", rootPath);
  }

  @Override
  public void onSessionStart(SessionRepr session) {
    timeStats = new TimeStats(clock);
    timeStats.start(INIT_PHASE);
  }

  @Override
  public void onCollectionStart() {
    timeStats.stop(INIT_PHASE);
    timeStats.start(COLLECTION);
    state.prepareForCollection();
  }

  @Override
  public void onCollectReport(CollectReportRepr report) {
    CollectionUpdate update = state.addCollected(report);
    if (update.added()) {
      collectionProgress = state.formatCollectionProgress(false);
    }
    if (update.failed()) {
      log.warn("Collection failed for {}", report.nodeId());
    } else if (report.outcome() != ReportOutcome.PASSED) {
      log.info("Collection {} for {}", report.outcome().wireName(), report.nodeId());
    }
  }

  @Override
  public void onDeselect(List<ItemRepr> items) {
    state.deselect(items);
  }

  @Override
  public void onCollectionFinish() {
    timeStats.stop(COLLECTION);
    collectionProgress = state.formatCollectionProgress(true);
    log.info("Collection {}", collectionProgress);
  }

  @Override
  public void onStartRunPhase() {
    timeStats.start(EXECUTION);
    if (selection.isEmpty() || layout.groups().isEmpty()) {
      layout = grouper.layout(state.items(), width, height);
      log.debug("Laid out {} tests in {} progress groups", layout.memberCount(), layout.groups().size());
    }
  }

  @Override
  public void onStartTest(NodeId nodeId) {
    state.startTest(nodeId).ifPresent(record -> {
      runningTests.add(nodeId);
      peakRunning = Math.max(peakRunning, runningTests.size());
    });
  }

  @Override
  public void onTestReport(TestReportRepr report) {
    Optional<TestRecord> stored = state.storeReport(report);
    if (stored.isEmpty()) {
      return;
    }
    TestRecord record = stored.get();
    if (!record.finished()) {
      return;
    }
    if (record.mainErrorReport().isPresent()) {
      if (failingTests.add(record.nodeId())) {
        log.debug("Test failed: {}", record.nodeId());
      }
    } else {
      failingTests.remove(record.nodeId());
    }
  }

  @Override
  public void onEndTest(NodeId nodeId) {
    state.endTest(nodeId).ifPresent(record -> runningTests.remove(nodeId));
  }

  @Override
  public void onWarning(WarningRepr warning) {
    warnings.add(warning);
  }

  @Override
  public void onInternalError(String text) {
    internalErrors.add(text);
    log.error("Engine internal error: {}", text);
  }

  @Override
  public void onKeyboardInterrupt(String text) {
    interrupted = true;
    log.warn("Engine run interrupted: {}", text);
  }

  @Override
  public void onSessionEnd(int exitStatus) {
    timeStats.stop(EXECUTION);
    sessionExitStatus = exitStatus;
  }

  @Override
  public void onRunFinished(RunResult result) {
    runningTests.clear();
    Optional<ChildProcessException> failure = result.failure();
    if (failure.isPresent() || interrupted) {
      int affected = state.markInterrupted();
      failure.ifPresent(ex -> log.error("Run ended abnormally: {} ({} tests interrupted)",
          ex.getMessage(), affected));
    }
  }

  public ProgressLayout layout() {
    return layout;
  }

  public TestStateAggregator state() {
    return state;
  }

  /** Tests whose latest run reported an error, in first-failure order. */
  public Set<NodeId> failingTests() {
    return Collections.unmodifiableSet(failingTests);
  }

  public Set<NodeId> runningTests() {
    return Collections.unmodifiableSet(runningTests);
  }

  /** Highest number of concurrently running tests seen; above one for parallel runs. */
  public int peakRunning() {
    return peakRunning;
  }

  public List<WarningRepr> warnings() {
    return Collections.unmodifiableList(warnings);
  }

  public List<String> internalErrors() {
    return Collections.unmodifiableList(internalErrors);
  }

  public String collectionProgress() {
    return collectionProgress;
  }

  public TimeStats timeStats() {
    return timeStats;
  }

  public Optional<Path> rootPath() {
    return Optional.ofNullable(rootPath);
  }

  public Optional<Integer> sessionExitStatus() {
    return Optional.ofNullable(sessionExitStatus);
  }

  public boolean interrupted() {
    return interrupted;
  }

  /**
   * Formats the run summary.
   *
   * @param includeTimings append phase timings
   * @return summary lines
   */
  public List<String> summary(boolean includeTimings) {
    return summaryFormatter.format(state, true, includeTimings ? timeStats : null);
  }
}
