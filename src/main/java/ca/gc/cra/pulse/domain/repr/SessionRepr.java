package ca.gc.cra.pulse.domain.repr;

import java.util.Objects;

/**
 * Snapshot of a test session.
 *
 * @param config session configuration, when the engine exposed it
 * @since 0.1.0
 */
public record SessionRepr(Attr<ConfigRepr> config) implements Representation {
  public SessionRepr {
    Objects.requireNonNull(config, "config");
  }
}
