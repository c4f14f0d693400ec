package ca.gc.cra.pulse.domain.repr;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Snapshot of a container node such as a module or class.
 *
 * @param nodeId collector identifier
 * @param name short name
 * @param path source path
 * @param kind container kind
 * @since 0.1.0
 */
public record CollectorRepr(NodeId nodeId, String name, Attr<String> path, NodeKind kind)
    implements NodeRepr {
  public CollectorRepr {
    Objects.requireNonNull(nodeId, "nodeId");
    name = name == null ? "" : name;
    path = Objects.requireNonNullElse(path, Attr.absent());
    kind = kind == null || kind.isItem() ? NodeKind.COLLECTOR : kind;
  }

  @Override
  public CollectorRepr withRoot(Path rootPath) {
    return new CollectorRepr(nodeId.withRoot(rootPath), name, path, kind);
  }
}
