/**
 * Byte-stream to line reassembly for engine output.
 */
package ca.gc.cra.pulse.infrastructure.stream;
