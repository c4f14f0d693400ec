package ca.gc.cra.pulse.application.state;

import ca.gc.cra.pulse.domain.error.LifecycleOrderException;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.Phase;
import ca.gc.cra.pulse.domain.repr.ReportOutcome;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.state.CollectionUpdate;
import ca.gc.cra.pulse.domain.state.CompletionCounts;
import ca.gc.cra.pulse.domain.state.TestStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-memory model of the current run: collected tests, their phase reports and the
 * collection bookkeeping.
 * <p><strong>Why:</strong> Parallel engines deliver duplicated, reordered and truncated event sequences; the
 * front end needs one consistent answer to "what state is each test in".</p>
 * <p><strong>Role:</strong> Application service fed by {@code RunController} and queried by renderers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register collected items once, keyed on the collect report's node id.</li>
 *   <li>Write each phase slot at most once per run; later duplicates are logged and ignored.</li>
 *   <li>Expose live filtered views over the record map.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the dispatching thread.</p>
 *
 * @since 0.1.0
 */
public final class TestStateAggregator {
  private static final Logger log = LoggerFactory.getLogger(TestStateAggregator.class);

  private final Map<NodeId, TestRecord> items = new LinkedHashMap<>();
  private final Map<NodeId, CollectReportRepr> collectFailures = new LinkedHashMap<>();
  private final Map<NodeId, CollectReportRepr> collectSkipped = new LinkedHashMap<>();
  private final Set<NodeId> deselected = new LinkedHashSet<>();
  private final Set<NodeId> processedCollectReports = new HashSet<>();
  private int finishedCount;

  /**
   * Prepares for a new run.
   *
   * @param selection node ids selected for a partial rerun; empty for a full run
   */
  public void prepareForRun(Set<NodeId> selection) {
    if (selection == null || selection.isEmpty()) {
      items.clear();
      collectFailures.clear();
      collectSkipped.clear();
      deselected.clear();
      processedCollectReports.clear();
      finishedCount = 0;
      return;
    }
    processedCollectReports.clear();
  }

  /**
   * Resets the selected records and parks every other one.
   *
   * @param selection node ids about to be rerun
   */
  public void parkAndReset(Set<NodeId> selection) {
    Objects.requireNonNull(selection, "selection");
    for (TestRecord record : items.values()) {
      if (selection.contains(record.nodeId())) {
        resetRecord(record);
      } else {
        record.park();
      }
    }
  }

  /** Clears collect-report de-duplication ahead of a collection pass. */
  public void prepareForCollection() {
    processedCollectReports.clear();
  }

  /**
   * Applies one collection report.
   *
   * @param report collect report
   * @return whether tests were added and whether a new collection failure was recorded
   */
  public CollectionUpdate addCollected(CollectReportRepr report) {
    Objects.requireNonNull(report, "report");
    if (!processedCollectReports.add(report.nodeId())) {
      log.debug("Collect report for {} already processed", report.nodeId());
      return CollectionUpdate.NONE;
    }
    if (report.outcome() == ReportOutcome.FAILED) {
      collectFailures.put(report.nodeId(), report);
      return new CollectionUpdate(false, true);
    }
    if (report.outcome() == ReportOutcome.SKIPPED) {
      collectSkipped.put(report.nodeId(), report);
      return CollectionUpdate.NONE;
    }
    for (ItemRepr item : report.items()) {
      items.computeIfAbsent(item.nodeId(), id -> new TestRecord(item));
    }
    return new CollectionUpdate(true, false);
  }

  /**
   * Records deselected items and drops them from the run.
   *
   * @param deselectedItems items the engine deselected
   */
  public void deselect(List<ItemRepr> deselectedItems) {
    for (ItemRepr item : deselectedItems) {
      deselected.add(item.nodeId());
      TestRecord removed = items.remove(item.nodeId());
      if (removed != null && removed.finished()) {
        finishedCount--;
      }
    }
  }

  /**
   * Marks a test as started.
   *
   * @param nodeId test id
   * @return the record, or empty for an unknown id
   */
  public Optional<TestRecord> startTest(NodeId nodeId) {
    Optional<TestRecord> record = find(nodeId, "start");
    record.ifPresent(TestRecord::markStarted);
    return record;
  }

  /**
   * Stores a report in the given phase slot.
   *
   * @param nodeId test id
   * @param phase phase slot
   * @param report report to store
   * @return the record, or empty for an unknown id
   */
  public Optional<TestRecord> storePhaseReport(NodeId nodeId, Phase phase, TestReportRepr report) {
    Optional<TestRecord> found = find(nodeId, phase.wireName() + " report");
    if (found.isEmpty()) {
      return found;
    }
    TestRecord record = found.get();
    if (record.hasReport(phase)) {
      LifecycleOrderException problem = new LifecycleOrderException(
          "duplicate " + phase.wireName() + " report for " + nodeId);
      log.warn("Ignoring report: {}", problem.getMessage());
      return found;
    }
    if (phase == Phase.TEARDOWN) {
      finishedCount++;
    }
    TestReportRepr stored = report.when() == phase
        ? report
        : new TestReportRepr(report.nodeId(), phase, report.outcome(), report.duration(),
            report.start(), report.stop(), report.location(), report.sections(),
            report.longRepr(), report.wasXfail(), report.workerId());
    record.store(stored);
    return found;
  }

  /**
   * Stores a report in the slot named by its own phase.
   *
   * @param report test report
   * @return the record, or empty for an unknown id
   */
  public Optional<TestRecord> storeReport(TestReportRepr report) {
    return storePhaseReport(report.nodeId(), report.when(), report);
  }

  /**
   * Notes the end of a test.
   *
   * @param nodeId test id
   * @return the record, or empty for an unknown id
   */
  public Optional<TestRecord> endTest(NodeId nodeId) {
    return find(nodeId, "end");
  }

  public void park(NodeId nodeId) {
    find(nodeId, "park").ifPresent(TestRecord::park);
  }

  public void reset(NodeId nodeId) {
    find(nodeId, "reset").ifPresent(this::resetRecord);
  }

  /**
   * Flags every unfinished, non-parked record as interrupted.
   *
   * @return number of records affected
   */
  public int markInterrupted() {
    int count = 0;
    for (TestRecord record : items.values()) {
      if (!record.parked() && !record.finished() && !record.interrupted()) {
        record.markInterrupted();
        count++;
      }
    }
    if (count > 0) {
      log.info("Marked {} unfinished tests as interrupted", count);
    }
    return count;
  }

  public List<TestRecord> passed() {
    return filter(r -> r.passedReport().isPresent() && r.xpassedReport().isEmpty() && r.finished());
  }

  /** Unexpected failures; excludes expected failures and setup errors. */
  public List<TestRecord> failed() {
    return filter(r -> r.failedReport().isPresent()
        && r.xfailedReport().isEmpty()
        && r.setupErrorReport().isEmpty());
  }

  public List<TestRecord> xfailed() {
    return filter(r -> r.xfailedReport().isPresent());
  }

  public List<TestRecord> xpassed() {
    return filter(r -> r.xpassedReport().isPresent());
  }

  public List<TestRecord> skipped() {
    return filter(r -> r.skippedReport().isPresent() && r.xfailedReport().isEmpty());
  }

  public List<TestRecord> setupErrored() {
    return filter(r -> r.setupErrorReport().isPresent());
  }

  public List<TestRecord> teardownErrored() {
    return filter(r -> r.teardownErrorReport().isPresent());
  }

  /** Records without a teardown report. */
  public List<TestRecord> notRun() {
    return filter(r -> !r.finished());
  }

  public CompletionCounts completionCounts() {
    return new CompletionCounts(finishedCount, items.size());
  }

  public int finishedCount() {
    return finishedCount;
  }

  /**
   * Returns records for the given ids, or all records when none are given.
   *
   * @param nodeIds ids to query; unknown ids are skipped
   * @return matching records in request order
   */
  public List<TestRecord> queryResults(Collection<NodeId> nodeIds) {
    if (nodeIds == null || nodeIds.isEmpty()) {
      return List.copyOf(items.values());
    }
    List<TestRecord> result = new ArrayList<>(nodeIds.size());
    for (NodeId nodeId : nodeIds) {
      TestRecord record = items.get(nodeId);
      if (record != null) {
        result.add(record);
      }
    }
    return result;
  }

  /** Counts records by their current status. */
  public Map<TestStatus, Integer> statusCounts() {
    Map<TestStatus, Integer> counts = new EnumMap<>(TestStatus.class);
    for (TestRecord record : items.values()) {
      counts.merge(record.status(), 1, Integer::sum);
    }
    return counts;
  }

  public Optional<TestRecord> lookup(NodeId nodeId) {
    return Optional.ofNullable(items.get(nodeId));
  }

  public Map<NodeId, CollectReportRepr> collectFailures() {
    return Collections.unmodifiableMap(collectFailures);
  }

  public Map<NodeId, CollectReportRepr> collectSkipped() {
    return Collections.unmodifiableMap(collectSkipped);
  }

  public Set<NodeId> deselected() {
    return Collections.unmodifiableSet(deselected);
  }

  /** Collected node ids in collection order. */
  public Set<NodeId> items() {
    return Collections.unmodifiableSet(items.keySet());
  }

  /**
   * Describes collection progress, for example {@code running: selected=12 skipped=1 failed=2}.
   *
   * @param complete whether collection has finished
   * @return progress text; zero counts other than {@code selected} are omitted
   */
  public String formatCollectionProgress(boolean complete) {
    StringBuilder sb = new StringBuilder(complete ? "complete" : "running")
        .append(": selected=").append(items.size());
    if (!collectSkipped.isEmpty()) {
      sb.append(" skipped=").append(collectSkipped.size());
    }
    if (!deselected.isEmpty()) {
      sb.append(" deselected=").append(deselected.size());
    }
    if (!collectFailures.isEmpty()) {
      sb.append(" failed=").append(collectFailures.size());
    }
    return sb.toString();
  }

  private void resetRecord(TestRecord record) {
    if (record.finished()) {
      finishedCount--;
    }
    record.reset();
  }

  private Optional<TestRecord> find(NodeId nodeId, String action) {
    TestRecord record = items.get(nodeId);
    if (record == null) {
      LifecycleOrderException problem =
          new LifecycleOrderException(action + " for unknown test " + nodeId);
      log.warn("Lifecycle order problem: {}", problem.getMessage());
      return Optional.empty();
    }
    return Optional.of(record);
  }

  private List<TestRecord> filter(Predicate<TestRecord> predicate) {
    List<TestRecord> result = new ArrayList<>();
    for (TestRecord record : items.values()) {
      if (predicate.test(record)) {
        result.add(record);
      }
    }
    return result;
  }
}
