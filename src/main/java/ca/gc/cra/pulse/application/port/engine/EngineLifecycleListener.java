package ca.gc.cra.pulse.application.port.engine;

import java.util.List;

/**
 * <strong>What:</strong> Lifecycle callbacks the test-execution engine invokes while it runs.
 * <p><strong>Role:</strong> Driven port on the producer side, implemented by the pipe emitter.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept calls from the engine's main thread
 * and from one auxiliary collection thread concurrently.</p>
 *
 * @since 0.1.0
 */
public interface EngineLifecycleListener {
  void configured(EngineConfig config);

  void sessionStart(EngineSession session);

  void runTestLoop();

  void collectionStart();

  void collectReport(EngineCollectReport report);

  void deselected(List<EngineNode> items);

  void collectionFinish();

  void testStart(String nodeId);

  void testReport(EngineTestReport report);

  void testFinish(String nodeId);

  void warningRecorded(EngineWarning warning);

  void internalError(String text);

  void keyboardInterrupt(String text);

  void sessionFinish(int exitStatus);

  void unconfigure();
}
