package ca.gc.cra.pulse.domain.repr;

import java.util.Objects;

/**
 * Snapshot of a warning recorded by the engine.
 *
 * @param message warning text
 * @param category warning category name
 * @param when engine stage that recorded it ({@code config}, {@code collect} or {@code runtest})
 * @param nodeId id of the node being processed; empty when not tied to a node
 * @param filename source file that raised the warning
 * @param lineNumber source line
 * @param function function that raised the warning
 * @since 0.1.0
 */
public record WarningRepr(
    String message,
    String category,
    String when,
    String nodeId,
    Attr<String> filename,
    Attr<Integer> lineNumber,
    Attr<String> function) implements Representation {
  public WarningRepr {
    message = message == null ? "" : message;
    category = category == null ? "Warning" : category;
    when = when == null ? "" : when;
    nodeId = nodeId == null ? "" : nodeId;
    filename = Objects.requireNonNullElse(filename, Attr.absent());
    lineNumber = Objects.requireNonNullElse(lineNumber, Attr.absent());
    function = Objects.requireNonNullElse(function, Attr.absent());
  }

  /** Key used to forward each distinct warning once. */
  public String dedupKey() {
    return String.join(
        "\u0000",
        message,
        when,
        nodeId,
        filename.orElse(""),
        String.valueOf(lineNumber.orElse(-1)),
        function.orElse(""));
  }
}
