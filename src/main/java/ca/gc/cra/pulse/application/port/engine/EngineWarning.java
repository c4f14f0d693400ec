package ca.gc.cra.pulse.application.port.engine;

/**
 * Engine-side view of a recorded warning.
 *
 * @since 0.1.0
 */
public interface EngineWarning {
  String message();

  String category();

  /** {@code config}, {@code collect} or {@code runtest}. */
  String when();

  /** Node being processed; may be empty. */
  String nodeId();

  default String filename() {
    return null;
  }

  default Integer lineNumber() {
    return null;
  }

  default String function() {
    return null;
  }
}
