package ca.gc.cra.pulse.application.port.engine;

import ca.gc.cra.pulse.domain.repr.Section;
import java.util.List;

/**
 * Engine-side view of a collection report.
 *
 * @since 0.1.0
 */
public interface EngineCollectReport {
  String nodeId();

  /** {@code passed}, {@code failed} or {@code skipped}. */
  String outcome();

  List<EngineNode> result();

  default List<Section> sections() {
    return List.of();
  }

  /** Failure or skip description; text is carried, other values become unrepresentable. */
  default Object longRepr() {
    return null;
  }

  /**
   * Distinguishes the first collector to report a node from duplicates produced by concurrent
   * collectors. Only primary reports are forwarded.
   *
   * @return {@code true} for the primary report
   */
  default boolean primary() {
    return true;
  }
}
