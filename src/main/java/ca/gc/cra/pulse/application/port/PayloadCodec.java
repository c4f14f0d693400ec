package ca.gc.cra.pulse.application.port;

import ca.gc.cra.pulse.domain.error.DecodeException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Converts argument values to transport-safe text tokens and back.
 * <p><strong>Why:</strong> Engine objects and primitives must travel as single whitespace-free tokens
 * inside a text line.</p>
 * <p><strong>Role:</strong> Port used by the emitter (encode) and dispatcher (decode).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map engine objects to their representation, recursing into lists.</li>
 *   <li>Never throw while encoding; unrepresentable values become placeholders.</li>
 *   <li>Rehydrate node ids against the root path captured from the last decoded configuration.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #encode(Object)} must be safe to call from several callback
 * threads; {@link #decode(String)} is called from the single dispatch thread.</p>
 *
 * @since 0.1.0
 */
public interface PayloadCodec {
  /**
   * Encodes a value as a single token.
   *
   * @param value engine object, representation, list or primitive; may be {@code null}
   * @return hexadecimal token
   */
  String encode(Object value);

  /**
   * Decodes a token produced by {@link #encode(Object)}.
   *
   * @param token hexadecimal token
   * @return decoded representation, list or primitive; may be {@code null}
   * @throws DecodeException when the token is not valid hex or does not hold a valid payload
   */
  Object decode(String token) throws DecodeException;

  /**
   * Returns the root path captured from the most recently decoded configuration.
   *
   * @return root path, or empty before any configuration was decoded
   */
  Optional<Path> rootPath();
}
