/**
 * Representations of engine objects carried across the process boundary.
 * <p><strong>Role:</strong> Domain layer; one immutable record per engine object kind.</p>
 * <p><strong>Concurrency:</strong> Immutable and safe to share.</p>
 */
package ca.gc.cra.pulse.domain.repr;
