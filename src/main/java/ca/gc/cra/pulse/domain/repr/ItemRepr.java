package ca.gc.cra.pulse.domain.repr;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Snapshot of a runnable test item.
 *
 * @param nodeId test identifier
 * @param name short test name, including any parametrization suffix
 * @param path source file path
 * @param originalName function name without the parametrization suffix
 * @param parentId identifier of the enclosing collector
 * @param kind item kind; always one where {@link NodeKind#isItem()} holds
 * @since 0.1.0
 */
public record ItemRepr(
    NodeId nodeId,
    String name,
    Attr<String> path,
    Attr<String> originalName,
    Attr<NodeId> parentId,
    NodeKind kind) implements NodeRepr {
  public ItemRepr {
    Objects.requireNonNull(nodeId, "nodeId");
    name = name == null ? nodeId.name() : name;
    path = Objects.requireNonNullElse(path, Attr.absent());
    originalName = Objects.requireNonNullElse(originalName, Attr.absent());
    parentId = Objects.requireNonNullElse(parentId, Attr.absent());
    kind = kind == null || !kind.isItem() ? NodeKind.ITEM : kind;
  }

  /**
   * Creates a bare item carrying only its identifier.
   *
   * @param nodeId test identifier
   * @return item representation
   */
  public static ItemRepr of(NodeId nodeId) {
    return new ItemRepr(nodeId, null, null, null, null, NodeKind.FUNCTION);
  }

  @Override
  public ItemRepr withRoot(Path rootPath) {
    Attr<NodeId> parent = parentId.isPresent()
        ? Attr.present(parentId.value().withRoot(rootPath))
        : parentId;
    return new ItemRepr(nodeId.withRoot(rootPath), name, path, originalName, parent, kind);
  }
}
