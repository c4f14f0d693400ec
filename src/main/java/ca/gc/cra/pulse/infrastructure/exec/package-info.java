/**
 * Thread factories for the emitter's writer and auxiliary collection threads.
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods returning named, non-daemon threads.</p>
 */
package ca.gc.cra.pulse.infrastructure.exec;
