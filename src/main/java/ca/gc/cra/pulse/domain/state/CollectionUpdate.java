package ca.gc.cra.pulse.domain.state;

/**
 * Result of registering one collection report.
 *
 * @param added at least one new test was registered
 * @param failed a new collection failure was recorded
 * @since 0.1.0
 */
public record CollectionUpdate(boolean added, boolean failed) {
  /** Update for a report that changed nothing. */
  public static final CollectionUpdate NONE = new CollectionUpdate(false, false);
}
