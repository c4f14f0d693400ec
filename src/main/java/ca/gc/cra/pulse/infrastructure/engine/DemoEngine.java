package ca.gc.cra.pulse.infrastructure.engine;

import ca.gc.cra.pulse.application.emit.PipeEmitter;
import ca.gc.cra.pulse.application.port.engine.EngineNode;
import ca.gc.cra.pulse.domain.repr.Location;
import ca.gc.cra.pulse.domain.repr.NodeKind;
import ca.gc.cra.pulse.domain.repr.Section;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Synthetic test engine that walks a {@link PipeEmitter} through a complete
 * run lifecycle.
 * <p><strong>Why:</strong> Exercises the emitter, the wire format and the consumer side end to end
 * without depending on a real test framework.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build a seeded, reproducible suite of modules and test functions.</li>
 *   <li>Collect on an auxiliary thread when more than one worker is configured.</li>
 *   <li>Produce setup, call and teardown reports with a fixed mix of outcomes.</li>
 *   <li>Print to standard output from some tests so redirected output is forwarded.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One {@link #run(Set)} at a time.</p>
 *
 * @since 0.1.0
 */
public final class DemoEngine {
  private static final Logger log = LoggerFactory.getLogger(DemoEngine.class);
  private static final String[] MODULE_NAMES = {
      "test_editing", "test_moving", "test_clipboard", "test_kb_selection", "test_editor", "test_cat_attack"};

  /** Engine exit status for a run with failures. */
  public static final int EXIT_TESTS_FAILED = 1;

  private final PipeEmitter emitter;
  private final Path rootPath;
  private final int modules;
  private final int testsPerModule;
  private final int workers;
  private final long seed;
  private final long delayMillis;

  /**
   * Creates a demo engine.
   *
   * @param emitter emitter receiving lifecycle callbacks
   * @param rootPath root directory reported in the configuration
   * @param modules number of test modules
   * @param testsPerModule tests per module
   * @param workers simulated parallel workers; above one, collection runs on an auxiliary thread
   * @param seed seed for outcome selection
   * @param delayMillis pause inside each test call
   */
  public DemoEngine(PipeEmitter emitter, Path rootPath, int modules, int testsPerModule, int workers,
      long seed, long delayMillis) {
    this.emitter = Objects.requireNonNull(emitter, "emitter");
    this.rootPath = Objects.requireNonNull(rootPath, "rootPath");
    if (modules <= 0 || testsPerModule <= 0 || workers <= 0) {
      throw new IllegalArgumentException("modules, testsPerModule and workers must be positive");
    }
    this.modules = modules;
    this.testsPerModule = testsPerModule;
    this.workers = workers;
    this.seed = seed;
    this.delayMillis = Math.max(0, delayMillis);
  }

  /**
   * Runs the suite.
   *
   * @param selection node ids to run; empty runs everything and anything else is deselected
   * @return engine exit status, {@code 0} or {@value #EXIT_TESTS_FAILED}
   * @throws InterruptedException if interrupted while pausing inside a test
   */
  public int run(Set<String> selection) throws InterruptedException {
    Objects.requireNonNull(selection, "selection");
    Map<String, Object> options = new LinkedHashMap<>();
    options.put("workers", workers);
    options.put("seed", seed);
    EngineRecords.Config config = new EngineRecords.Config(rootPath, options, List.of("pulse-demo"));

    emitter.start();
    emitter.install();
    emitter.configured(config);
    emitter.sessionStart(new EngineRecords.Session(config));
    emitter.writeSep("=", "test session starts");
    emitter.runTestLoop();

    Map<EngineRecords.Node, List<EngineNode>> suite = buildSuite();
    List<EngineNode> selected = new ArrayList<>();
    List<EngineNode> deselected = new ArrayList<>();
    for (List<EngineNode> items : suite.values()) {
      for (EngineNode item : items) {
        if (selection.isEmpty() || selection.contains(item.nodeId())) {
          selected.add(item);
        } else {
          deselected.add(item);
        }
      }
    }

    Runnable collection = () -> collect(suite, deselected);
    if (workers > 1) {
      emitter.startAuxiliaryCollection(collection);
    } else {
      collection.run();
    }

    Random outcomes = new Random(seed);
    boolean failures = false;
    double clock = 0d;
    for (int i = 0; i < selected.size(); i++) {
      EngineNode item = selected.get(i);
      String worker = workers > 1 ? "gw" + (i % workers) : null;
      failures |= runTest(item, outcomes.nextInt(20), worker, clock);
      clock += 0.01d;
    }
    if (selected.isEmpty()) {
      log.debug("No tests selected");
    }

    int exitStatus = failures ? EXIT_TESTS_FAILED : 0;
    emitter.sessionFinish(exitStatus);
    emitter.writeSep("=", selected.size() + " tests run");
    emitter.unconfigure();
    return exitStatus;
  }

  private Map<EngineRecords.Node, List<EngineNode>> buildSuite() {
    Map<EngineRecords.Node, List<EngineNode>> suite = new LinkedHashMap<>();
    for (int m = 0; m < modules; m++) {
      String moduleName = MODULE_NAMES[m % MODULE_NAMES.length]
          + (m < MODULE_NAMES.length ? "" : "_" + (m / MODULE_NAMES.length)) + ".py";
      Path modulePath = rootPath.resolve(moduleName);
      EngineRecords.Node module = new EngineRecords.Node(moduleName, moduleName, NodeKind.MODULE, modulePath, null);
      List<EngineNode> items = new ArrayList<>(testsPerModule);
      for (int t = 0; t < testsPerModule; t++) {
        String name = "test_case_" + t;
        items.add(new EngineRecords.Node(moduleName + "::" + name, name, NodeKind.FUNCTION, modulePath, module));
      }
      suite.put(module, items);
    }
    return suite;
  }

  private void collect(Map<EngineRecords.Node, List<EngineNode>> suite, List<EngineNode> deselected) {
    emitter.collectionStart();
    for (Map.Entry<EngineRecords.Node, List<EngineNode>> entry : suite.entrySet()) {
      emitter.collectReport(new EngineRecords.CollectReport(
          entry.getKey().nodeId(), "passed", entry.getValue(), null));
    }
    if (!deselected.isEmpty()) {
      emitter.deselected(deselected);
    }
    emitter.collectionFinish();
  }

  private boolean runTest(EngineNode item, int roll, String worker, double clock)
      throws InterruptedException {
    String id = item.nodeId();
    Location location = new Location(item.path() == null ? id : rootPath.relativize(item.path()).toString(),
        0, item.name());
    emitter.testStart(id);
    boolean failed = false;
    if (roll == 1) {
      emitter.testReport(report(id, "setup", "failed", clock, location, "fixture 'editor' raised", null, worker));
      failed = true;
    } else if (roll == 2) {
      emitter.testReport(report(id, "setup", "skipped", clock, location, "needs a display", null, worker));
    } else {
      emitter.testReport(report(id, "setup", "passed", clock, location, null, null, worker));
      if (delayMillis > 0) {
        TimeUnit.MILLISECONDS.sleep(delayMillis);
      }
      if (roll == 6) {
        System.out.println("captured output from " + item.name());
        emitter.warningRecorded(new EngineRecords.Warning("deprecated call in " + item.name(),
            "DeprecationWarning", "runtest", id, location.path(), 1, item.name()));
      }
      String call = switch (roll) {
        case 0 -> "failed";
        case 3 -> "skipped";
        default -> "passed";
      };
      String wasXfail = roll == 3 || roll == 5 ? "known issue" : null;
      String longRepr = roll == 0 ? "AssertionError: assert 1 == 2" : null;
      emitter.testReport(report(id, "call", call, clock, location, longRepr, wasXfail, worker));
      failed = roll == 0;
    }
    String teardown = roll == 4 ? "failed" : "passed";
    emitter.testReport(report(id, "teardown", teardown, clock, location,
        roll == 4 ? "teardown of fixture 'editor' raised" : null, null, worker));
    emitter.testFinish(id);
    return failed || roll == 4;
  }

  private static EngineRecords.TestReport report(String id, String when, String outcome, double clock,
      Location location, String longRepr, String wasXfail, String worker) {
    List<Section> sections = longRepr == null
        ? List.of()
        : List.of(new Section("Captured log " + when, longRepr));
    return new EngineRecords.TestReport(id, when, outcome, 0.001d, clock, clock + 0.001d, location,
        sections, longRepr, wasXfail, worker);
  }
}
