package ca.gc.cra.pulse.application.progress;

import ca.gc.cra.pulse.domain.progress.ProgressGroup;
import ca.gc.cra.pulse.domain.progress.ProgressLayout;
import ca.gc.cra.pulse.domain.repr.NodeId;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lays collected tests out as labelled progress rows.
 *
 * <p>Tests are grouped by source file. A group longer than the row space is split into chunks named
 * {@code name[2]}, {@code name[3]}, ... with empty labels. When the groups do not fit the surface height
 * the tests are regrouped by parent directory instead.</p>
 *
 * @since 0.1.0
 */
public final class ProgressGrouper {
  static final int MIN_ROW_SPACE = 30;
  static final int DEFAULT_LABEL_WIDTH = 10;
  static final int ROW_DECORATION = 9;
  static final int RESERVED_LINES = 6;

  private static final Pattern CHUNK_SUFFIX = Pattern.compile("(.*)\\[(\\d{1,9})\\]$");
  private static final Comparator<ProgressGroup> ORDER = Comparator
      .comparing((ProgressGroup g) -> baseName(g.name()))
      .thenComparingInt(g -> chunkNumber(g.name()));

  /**
   * Computes the layout for a surface.
   *
   * @param nodeIds tests to lay out, in collection order
   * @param width surface width in columns
   * @param height surface height in lines
   * @return layout partitioning {@code nodeIds}
   */
  public ProgressLayout layout(Collection<NodeId> nodeIds, int width, int height) {
    if (nodeIds.isEmpty()) {
      return new ProgressLayout(List.of(), width, height);
    }
    List<ProgressGroup> groups = split(groupBy(nodeIds, id -> id.filePath().toString()), width);
    if (groups.size() > height - RESERVED_LINES) {
      groups = split(groupBy(nodeIds, ProgressGrouper::directoryOf), width);
    }
    groups.sort(ORDER);
    return new ProgressLayout(groups, width, height);
  }

  private static Map<String, List<NodeId>> groupBy(
      Collection<NodeId> nodeIds, Function<NodeId, String> key) {
    Map<String, List<NodeId>> groups = new LinkedHashMap<>();
    for (NodeId nodeId : nodeIds) {
      groups.computeIfAbsent(key.apply(nodeId), k -> new ArrayList<>()).add(nodeId);
    }
    return groups;
  }

  private static List<ProgressGroup> split(Map<String, List<NodeId>> groups, int width) {
    int labelWidth = DEFAULT_LABEL_WIDTH;
    if (!groups.isEmpty()) {
      labelWidth = 0;
      for (String name : groups.keySet()) {
        labelWidth = Math.max(labelWidth, name.length());
      }
    }
    int space = Math.max(MIN_ROW_SPACE, width - labelWidth - ROW_DECORATION);
    List<ProgressGroup> result = new ArrayList<>();
    for (Map.Entry<String, List<NodeId>> entry : groups.entrySet()) {
      String name = entry.getKey();
      List<NodeId> members = entry.getValue();
      if (members.size() <= space) {
        result.add(new ProgressGroup(name, members, name));
        continue;
      }
      int chunk = 1;
      for (int from = 0; from < members.size(); from += space) {
        List<NodeId> slice = members.subList(from, Math.min(members.size(), from + space));
        if (chunk == 1) {
          result.add(new ProgressGroup(name, slice, name));
        } else {
          result.add(new ProgressGroup(name + "[" + chunk + "]", slice, ""));
        }
        chunk++;
      }
    }
    return result;
  }

  private static String directoryOf(NodeId nodeId) {
    Path parent = nodeId.filePath().getParent();
    return parent == null ? "." : parent.toString();
  }

  static String baseName(String name) {
    Matcher m = CHUNK_SUFFIX.matcher(name);
    return m.matches() ? m.group(1) : name;
  }

  static int chunkNumber(String name) {
    Matcher m = CHUNK_SUFFIX.matcher(name);
    return m.matches() ? Integer.parseInt(m.group(2)) : 0;
  }
}
