package ca.gc.cra.pulse.domain.repr;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a collection report produced when a collector finishes walking one node.
 *
 * @param nodeId identifier of the collector that produced the report
 * @param outcome collection outcome
 * @param when phase label, normally {@code "collect"}
 * @param result nodes found by the collector
 * @param sections captured output
 * @param longRepr failure or skip description as text
 * @since 0.1.0
 */
public record CollectReportRepr(
    NodeId nodeId,
    ReportOutcome outcome,
    String when,
    List<NodeRepr> result,
    List<Section> sections,
    Attr<String> longRepr) implements Representation {
  public CollectReportRepr {
    Objects.requireNonNull(nodeId, "nodeId");
    Objects.requireNonNull(outcome, "outcome");
    when = when == null ? "collect" : when;
    result = result == null ? List.of() : List.copyOf(result);
    sections = sections == null ? List.of() : List.copyOf(sections);
    longRepr = Objects.requireNonNullElse(longRepr, Attr.absent());
  }

  /** Items (runnable tests) contained in {@link #result()}. */
  public List<ItemRepr> items() {
    List<ItemRepr> items = new ArrayList<>();
    for (NodeRepr node : result) {
      if (node instanceof ItemRepr item) {
        items.add(item);
      }
    }
    return items;
  }

  /** Returns a copy whose node ids, including those of result nodes, are bound to {@code rootPath}. */
  public CollectReportRepr withRoot(Path rootPath) {
    List<NodeRepr> rebound = new ArrayList<>(result.size());
    for (NodeRepr node : result) {
      rebound.add(node.withRoot(rootPath));
    }
    return new CollectReportRepr(
        nodeId.withRoot(rootPath), outcome, when, rebound, sections, longRepr);
  }
}
