/**
 * Payload codec: engine objects to tagged JSON to hexadecimal tokens, and back.
 */
package ca.gc.cra.pulse.infrastructure.codec;
