package ca.gc.cra.pulse.application.port.engine;

import ca.gc.cra.pulse.domain.repr.Location;
import ca.gc.cra.pulse.domain.repr.Section;
import java.util.List;

/**
 * Engine-side view of a phase report.
 *
 * @since 0.1.0
 */
public interface EngineTestReport {
  String nodeId();

  /** {@code setup}, {@code call} or {@code teardown}. */
  String when();

  /** {@code passed}, {@code failed} or {@code skipped}. */
  String outcome();

  default double duration() {
    return 0d;
  }

  default double start() {
    return 0d;
  }

  default double stop() {
    return 0d;
  }

  default Location location() {
    return null;
  }

  default List<Section> sections() {
    return List.of();
  }

  /** Failure description; text is carried, other values become unrepresentable. */
  default Object longRepr() {
    return null;
  }

  /** Expected-failure reason; {@code null} unless the test was marked as an expected failure. */
  default String wasXfail() {
    return null;
  }

  /** Parallel worker id; {@code null} when not running in parallel. */
  default String workerId() {
    return null;
  }
}
