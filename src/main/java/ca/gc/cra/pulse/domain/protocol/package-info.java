/**
 * Wire protocol vocabulary: message kinds, messages and line framing.
 * <p><strong>Role:</strong> Domain layer shared by the producer and consumer sides.</p>
 * <p><strong>Concurrency:</strong> Immutable types; safe to share.</p>
 */
package ca.gc.cra.pulse.domain.protocol;
