/**
 * Byte buffers used by stream readers.
 */
package ca.gc.cra.pulse.infrastructure.buffer;
