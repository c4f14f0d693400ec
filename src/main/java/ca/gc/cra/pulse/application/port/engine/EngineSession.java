package ca.gc.cra.pulse.application.port.engine;

/**
 * Engine-side view of a test session.
 *
 * @since 0.1.0
 */
public interface EngineSession {
  /** Configuration the session runs with; may be {@code null}. */
  EngineConfig config();
}
