package ca.gc.cra.pulse.infrastructure.engine;

import ca.gc.cra.pulse.application.port.engine.EngineCollectReport;
import ca.gc.cra.pulse.application.port.engine.EngineConfig;
import ca.gc.cra.pulse.application.port.engine.EngineNode;
import ca.gc.cra.pulse.application.port.engine.EngineSession;
import ca.gc.cra.pulse.application.port.engine.EngineTestReport;
import ca.gc.cra.pulse.application.port.engine.EngineWarning;
import ca.gc.cra.pulse.domain.repr.Location;
import ca.gc.cra.pulse.domain.repr.NodeKind;
import ca.gc.cra.pulse.domain.repr.Section;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Plain value implementations of the engine object interfaces, for engines that have no richer
 * object model of their own.
 *
 * @since 0.1.0
 */
public final class EngineRecords {
  private EngineRecords() {}

  /** Engine configuration. */
  public record Config(Path rootPath, Map<String, Object> options, List<String> pluginNames)
      implements EngineConfig {
    public Config {
      options = Map.copyOf(options);
      pluginNames = List.copyOf(pluginNames);
    }
  }

  /** Engine session. */
  public record Session(EngineConfig config) implements EngineSession {}

  /** Test item or collector. */
  public record Node(String nodeId, String name, NodeKind kind, Path path, EngineNode parent)
      implements EngineNode {}

  /** Outcome of collecting one collector. */
  public record CollectReport(String nodeId, String outcome, List<EngineNode> result, Object longRepr)
      implements EngineCollectReport {
    public CollectReport {
      result = List.copyOf(result);
    }
  }

  /** Outcome of one test phase. */
  public record TestReport(
      String nodeId,
      String when,
      String outcome,
      double duration,
      double start,
      double stop,
      Location location,
      List<Section> sections,
      Object longRepr,
      String wasXfail,
      String workerId) implements EngineTestReport {
    public TestReport {
      sections = List.copyOf(sections);
    }
  }

  /** Warning raised during the run. */
  public record Warning(String message, String category, String when, String nodeId, String filename,
      Integer lineNumber, String function) implements EngineWarning {}
}
