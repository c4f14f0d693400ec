/**
 * Core domain model for PULSE test-run reporting.
 * <p><strong>Role:</strong> Domain layer describing messages, representations and run state without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.gc.cra.pulse.domain;
