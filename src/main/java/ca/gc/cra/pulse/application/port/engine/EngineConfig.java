package ca.gc.cra.pulse.application.port.engine;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Engine-side view of the run configuration.
 *
 * @since 0.1.0
 */
public interface EngineConfig {
  /** Root directory of the run. */
  Path rootPath();

  /**
   * Parsed command-line options. Values that are not strings, numbers or booleans are sent as
   * unrepresentable.
   */
  Map<String, Object> options();

  default List<String> pluginNames() {
    return List.of();
  }
}
