/**
 * Engine-side event emitter: callback to framed line, one writer thread.
 */
package ca.gc.cra.pulse.application.emit;
