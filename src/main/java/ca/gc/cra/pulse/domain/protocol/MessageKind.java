package ca.gc.cra.pulse.domain.protocol;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Enumeration of every message name understood by the wire protocol.
 * <p><strong>Why:</strong> Handlers subscribe to kinds rather than to free-form method names, so
 * unknown names can be detected and reported once.</p>
 * <p><strong>Role:</strong> Domain registry shared by the emitter (producer) and dispatcher (consumer).</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum MessageKind {
  /** Engine configured; argument is the configuration snapshot. */
  INIT("init", 1, false),
  SESSION_START("session_start", 1, false),
  RUN_TEST_LOOP("runtestloop", 0, false),
  COLLECTION_START("test_collection_start", 0, false),
  COLLECT_REPORT("test_collect_report", 1, false),
  /** Argument is the list of deselected items. */
  DESELECT_TESTS("deselect_tests", 1, false),
  COLLECTION_FINISH("test_collection_finish", 0, false),
  /** Inferred by the emitter when the first test starts outside collection. */
  START_RUN_PHASE("start_run_phase", 0, false),
  START_TEST("start_test", 1, true),
  TEST_REPORT("test_report", 1, true),
  END_TEST("end_test", 1, true),
  WARNING_RECORDED("warning_recorded", 1, false),
  INTERNAL_ERROR("internal_error", 1, false),
  KEYBOARD_INTERRUPT("keyboard_interrupt", 1, false),
  /** Argument is the engine exit status. */
  SESSION_END("session_end", 1, false),
  UNCONFIGURE("unconfigure", 0, false),
  WRITE("write", 1, false),
  WRITE_LINE("write_line", 1, false),
  WRITE_SEP("write_sep", 2, false),
  REWRITE("rewrite", 1, false),
  COPY_STDOUT("copy_stdout", 1, false),
  COPY_STDERR("copy_stderr", 1, false);

  private static final Map<String, MessageKind> BY_WIRE_NAME = new HashMap<>();

  static {
    for (MessageKind kind : values()) {
      BY_WIRE_NAME.put(kind.wireName, kind);
    }
  }

  private final String wireName;
  private final int arity;
  private final boolean runPhase;

  MessageKind(String wireName, int arity, boolean runPhase) {
    this.wireName = wireName;
    this.arity = arity;
    this.runPhase = runPhase;
  }

  /** Name written after the sentinel token. */
  public String wireName() {
    return wireName;
  }

  /** Number of arguments the message carries. */
  public int arity() {
    return arity;
  }

  /**
   * Indicates whether the message belongs to the run phase and must wait until the phase start has
   * been seen.
   *
   * @return {@code true} for start, report and end of a single test
   */
  public boolean runPhase() {
    return runPhase;
  }

  /**
   * Resolves a wire name.
   *
   * @param wireName name read from a frame
   * @return matching kind, or empty for names this build does not know
   */
  public static Optional<MessageKind> fromWireName(String wireName) {
    return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }
}
