package ca.gc.cra.pulse.domain.progress;

import ca.gc.cra.pulse.domain.repr.NodeId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of progress groups that partitions the known tests, with reverse lookup.
 *
 * @since 0.1.0
 */
public final class ProgressLayout {
  private static final ProgressLayout EMPTY = new ProgressLayout(List.of(), 0, 0);

  private final List<ProgressGroup> groups;
  private final Map<NodeId, ProgressGroup> byMember = new HashMap<>();
  private final Map<String, ProgressGroup> byName = new HashMap<>();
  private final int width;
  private final int height;

  /**
   * Creates a layout.
   *
   * @param groups ordered groups
   * @param width surface width the layout was computed for
   * @param height surface height the layout was computed for
   */
  public ProgressLayout(List<ProgressGroup> groups, int width, int height) {
    this.groups = List.copyOf(groups);
    this.width = width;
    this.height = height;
    for (ProgressGroup group : this.groups) {
      byName.put(group.name(), group);
      for (NodeId member : group.members()) {
        byMember.put(member, group);
      }
    }
  }

  public static ProgressLayout empty() {
    return EMPTY;
  }

  public List<ProgressGroup> groups() {
    return groups;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public Optional<ProgressGroup> groupOf(NodeId nodeId) {
    return Optional.ofNullable(byMember.get(nodeId));
  }

  public List<NodeId> membersOf(String groupName) {
    ProgressGroup group = byName.get(groupName);
    return group == null ? List.of() : group.members();
  }

  /** Total number of members across all groups. */
  public int memberCount() {
    return byMember.size();
  }
}
