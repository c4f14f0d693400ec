/**
 * Application layer orchestration for PULSE runs.
 * <p><strong>Role:</strong> Hosts the emitter, the dispatcher, the state aggregator, progress grouping and the
 * consumer session, plus the ports they depend on.</p>
 * <p><strong>Concurrency:</strong> The emitter serializes all callbacks onto one writer thread; the consumer
 * side is single-threaded.</p>
 * <p><strong>Metrics:</strong> Emits namespaces {@code emit.*}, {@code dispatch.*} and {@code session.*}.</p>
 */
package ca.gc.cra.pulse.application;
