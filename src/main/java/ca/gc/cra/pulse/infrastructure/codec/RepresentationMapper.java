package ca.gc.cra.pulse.infrastructure.codec;

import ca.gc.cra.pulse.application.port.engine.EngineCollectReport;
import ca.gc.cra.pulse.application.port.engine.EngineConfig;
import ca.gc.cra.pulse.application.port.engine.EngineNode;
import ca.gc.cra.pulse.application.port.engine.EngineSession;
import ca.gc.cra.pulse.application.port.engine.EngineTestReport;
import ca.gc.cra.pulse.application.port.engine.EngineWarning;
import ca.gc.cra.pulse.domain.error.EncodingException;
import ca.gc.cra.pulse.domain.repr.Attr;
import ca.gc.cra.pulse.domain.repr.CollectReportRepr;
import ca.gc.cra.pulse.domain.repr.CollectorRepr;
import ca.gc.cra.pulse.domain.repr.ConfigRepr;
import ca.gc.cra.pulse.domain.repr.ItemRepr;
import ca.gc.cra.pulse.domain.repr.NodeId;
import ca.gc.cra.pulse.domain.repr.NodeKind;
import ca.gc.cra.pulse.domain.repr.NodeRepr;
import ca.gc.cra.pulse.domain.repr.Phase;
import ca.gc.cra.pulse.domain.repr.ReportOutcome;
import ca.gc.cra.pulse.domain.repr.Representation;
import ca.gc.cra.pulse.domain.repr.SessionRepr;
import ca.gc.cra.pulse.domain.repr.TestReportRepr;
import ca.gc.cra.pulse.domain.repr.WarningRepr;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces engine objects to their whitelisted representations.
 *
 * <p>Only the attributes named by each representation are read. Node ids are cleaned of
 * parallel-runner group suffixes on the way through.</p>
 */
final class RepresentationMapper {

  /**
   * Maps an engine object to its representation.
   *
   * @param value engine object
   * @return representation
   * @throws EncodingException when the value is not a known engine kind or carries invalid data
   */
  Representation map(Object value) throws EncodingException {
    try {
      if (value instanceof EngineConfig config) {
        return config(config);
      } else if (value instanceof EngineSession session) {
        EngineConfig config = session.config();
        return new SessionRepr(config == null ? Attr.absent() : Attr.present(config(config)));
      } else if (value instanceof EngineNode node) {
        return node(node);
      } else if (value instanceof EngineCollectReport report) {
        return collectReport(report);
      } else if (value instanceof EngineTestReport report) {
        return testReport(report);
      } else if (value instanceof EngineWarning warning) {
        return warning(warning);
      }
    } catch (RuntimeException ex) {
      throw new EncodingException(
          value.getClass().getSimpleName(),
          "Cannot represent " + value.getClass().getSimpleName() + ": " + ex.getMessage());
    }
    throw new EncodingException(
        typeName(value), "Unsupported type " + typeName(value));
  }

  private ConfigRepr config(EngineConfig config) {
    Map<String, Attr<String>> options = new LinkedHashMap<>();
    Map<String, Object> raw = config.options();
    if (raw != null) {
      for (Map.Entry<String, Object> entry : raw.entrySet()) {
        options.put(entry.getKey(), scalar(entry.getValue()));
      }
    }
    return new ConfigRepr(config.rootPath(), options, config.pluginNames());
  }

  private NodeRepr node(EngineNode node) {
    NodeId id = nodeId(node.nodeId());
    NodeKind kind = node.kind() == null ? NodeKind.ITEM : node.kind();
    Attr<String> path = node.path() == null ? Attr.absent() : Attr.present(node.path().toString());
    if (!kind.isItem()) {
      return new CollectorRepr(id, node.name(), path, kind);
    }
    EngineNode parent = node.parent();
    Attr<NodeId> parentId = parent == null || parent.nodeId() == null
        ? Attr.absent()
        : Attr.present(nodeId(parent.nodeId()));
    return new ItemRepr(
        id, node.name(), path, Attr.ofNullable(node.originalName()), parentId, kind);
  }

  private CollectReportRepr collectReport(EngineCollectReport report) {
    List<NodeRepr> result = new ArrayList<>();
    List<EngineNode> nodes = report.result();
    if (nodes != null) {
      for (EngineNode node : nodes) {
        result.add(node(node));
      }
    }
    return new CollectReportRepr(
        nodeId(report.nodeId()),
        ReportOutcome.fromWire(report.outcome()),
        "collect",
        result,
        report.sections(),
        text(report.longRepr()));
  }

  private TestReportRepr testReport(EngineTestReport report) {
    return new TestReportRepr(
        nodeId(report.nodeId()),
        Phase.fromWire(report.when()),
        ReportOutcome.fromWire(report.outcome()),
        report.duration(),
        report.start(),
        report.stop(),
        Attr.ofNullable(report.location()),
        report.sections(),
        text(report.longRepr()),
        Attr.ofNullable(report.wasXfail()),
        Attr.ofNullable(report.workerId()));
  }

  private WarningRepr warning(EngineWarning warning) {
    return new WarningRepr(
        warning.message(),
        warning.category(),
        warning.when(),
        warning.nodeId() == null ? "" : NodeId.clean(warning.nodeId()),
        Attr.ofNullable(warning.filename()),
        Attr.ofNullable(warning.lineNumber()),
        Attr.ofNullable(warning.function()));
  }

  static NodeId nodeId(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("node id must not be null");
    }
    return NodeId.of(NodeId.clean(raw));
  }

  private static Attr<String> scalar(Object value) {
    if (value == null) {
      return Attr.absent();
    }
    if (value instanceof CharSequence
        || value instanceof Number
        || value instanceof Boolean
        || value instanceof Path) {
      return Attr.present(value.toString());
    }
    return Attr.unrepresentable(typeName(value));
  }

  private static Attr<String> text(Object value) {
    if (value == null) {
      return Attr.absent();
    }
    if (value instanceof CharSequence chars) {
      return Attr.present(chars.toString());
    }
    return Attr.unrepresentable(typeName(value));
  }

  static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getSimpleName();
  }
}
