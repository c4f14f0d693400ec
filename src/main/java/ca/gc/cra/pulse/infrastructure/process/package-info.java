/**
 * Engine process adapters: child processes and recorded replays.
 */
package ca.gc.cra.pulse.infrastructure.process;
