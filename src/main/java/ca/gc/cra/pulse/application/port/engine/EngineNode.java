package ca.gc.cra.pulse.application.port.engine;

import ca.gc.cra.pulse.domain.repr.NodeKind;
import java.nio.file.Path;

/**
 * Engine-side view of a collected node (test item or collector).
 *
 * @since 0.1.0
 */
public interface EngineNode {
  String nodeId();

  String name();

  NodeKind kind();

  /** Source path; may be {@code null}. */
  default Path path() {
    return null;
  }

  /** Enclosing node; {@code null} for the session root. */
  default EngineNode parent() {
    return null;
  }

  /** Function name without any parametrization suffix; {@code null} for collectors. */
  default String originalName() {
    return null;
  }
}
