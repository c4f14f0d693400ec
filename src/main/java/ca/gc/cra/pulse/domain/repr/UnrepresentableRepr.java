package ca.gc.cra.pulse.domain.repr;

import java.util.Objects;

/**
 * Placeholder sent in place of a value the codec could not represent.
 *
 * @param typeName simple type name of the original value
 * @param text truncated {@code toString()} of the original value
 * @since 0.1.0
 */
public record UnrepresentableRepr(String typeName, String text) implements Representation {
  public UnrepresentableRepr {
    Objects.requireNonNull(typeName, "typeName");
    text = text == null ? "" : text;
  }
}
