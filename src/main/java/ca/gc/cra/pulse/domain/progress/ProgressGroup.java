package ca.gc.cra.pulse.domain.progress;

import ca.gc.cra.pulse.domain.repr.NodeId;
import java.util.List;
import java.util.Objects;

/**
 * One display group of the progress layout.
 *
 * @param name group name; continuation chunks carry a {@code [n]} suffix
 * @param members ordered members
 * @param label display label; empty for continuation chunks
 * @since 0.1.0
 */
public record ProgressGroup(String name, List<NodeId> members, String label) {
  public ProgressGroup {
    Objects.requireNonNull(name, "name");
    members = members == null ? List.of() : List.copyOf(members);
    label = label == null ? "" : label;
  }

  public int size() {
    return members.size();
  }

  /** Returns {@code true} for a chunk that continues a preceding group. */
  public boolean continuation() {
    return label.isEmpty();
  }
}
