package ca.gc.cra.pulse.domain.repr;

import java.nio.file.Path;

/**
 * Collected node: either a runnable test item or a container collector.
 *
 * @since 0.1.0
 */
public sealed interface NodeRepr extends Representation permits ItemRepr, CollectorRepr {
  NodeId nodeId();

  String name();

  NodeKind kind();

  /** Returns a copy whose node id is bound to {@code rootPath}. */
  NodeRepr withRoot(Path rootPath);
}
