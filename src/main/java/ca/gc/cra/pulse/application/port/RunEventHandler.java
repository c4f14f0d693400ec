package ca.gc.cra.pulse.application.port;

import ca.gc.cra.pulse.domain.protocol.MessageKind;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.ConfigRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.SessionRepr;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.repr.WarningRepr;
import ca.gc.cra.pulse.domain.state.RunResult;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * <strong>What:</strong> Observer of decoded run messages.
 * <p><strong>Why:</strong> Replaces name-based method lookup with one typed callback per
 * {@link MessageKind}; handlers override only the callbacks they need.</p>
 * <p><strong>Role:</strong> Port registered with the message dispatcher by the aggregator-facing
 * controller and by rendering collaborators.</p>
 * <p><strong>Thread-safety:</strong> Callbacks are invoked from the single dispatch thread, in arrival
 * order; implementations need no locking for dispatcher-driven state.</p>
 *
 * @since 0.1.0
 */
public interface RunEventHandler {

  /**
   * Message kinds this handler wants. Arguments of a frame are only decoded when some handler
   * subscribes to its kind.
   *
   * @return subscribed kinds; defaults to all kinds
   */
  default Set<MessageKind> subscriptions() {
    return EnumSet.allOf(MessageKind.class);
  }

  default void onInit(ConfigRepr config) {}

  default void onSessionStart(SessionRepr session) {}

  default void onRunTestLoop() {}

  default void onCollectionStart() {}

  default void onCollectReport(CollectReportRepr report) {}

  default void onDeselect(List<ItemRepr> items) {}

  default void onCollectionFinish() {}

  default void onStartRunPhase() {}

  default void onStartTest(NodeId nodeId) {}

  default void onTestReport(TestReportRepr report) {}

  default void onEndTest(NodeId nodeId) {}

  default void onWarning(WarningRepr warning) {}

  default void onInternalError(String text) {}

  default void onKeyboardInterrupt(String text) {}

  default void onSessionEnd(int exitStatus) {}

  default void onUnconfigure() {}

  default void onWrite(String text) {}

  default void onWriteLine(String line) {}

  default void onWriteSep(String sep, String title) {}

  default void onRewrite(String line) {}

  default void onCopyStdout(String text) {}

  default void onCopyStderr(String text) {}

  /**
   * Receives a line of passthrough text that was not a protocol frame.
   *
   * @param line line without its terminator
   */
  default void onOutputLine(String line) {}

  /**
   * Called exactly once when the engine stream ends.
   *
   * @param result engine exit classification
   */
  default void onRunFinished(RunResult result) {}
}
