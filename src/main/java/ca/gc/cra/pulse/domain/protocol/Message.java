package ca.gc.cra.pulse.domain.protocol;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single protocol message: a name plus encoded argument payloads. Exists only on the wire.
 *
 * @param name message name
 * @param args encoded argument tokens, in order
 * @since 0.1.0
 */
public record Message(String name, List<String> args) {
  public Message {
    Objects.requireNonNull(name, "name");
    args = args == null ? List.of() : List.copyOf(args);
  }

  /**
   * Creates a message for a known kind.
   *
   * @param kind message kind
   * @param args encoded arguments
   * @return message
   */
  public static Message of(MessageKind kind, List<String> args) {
    return new Message(kind.wireName(), args);
  }

  /** Kind matching {@link #name()}, if known. */
  public Optional<MessageKind> kind() {
    return MessageKind.fromWireName(name);
  }
}
