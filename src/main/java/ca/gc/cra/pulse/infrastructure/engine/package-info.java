/**
 * Engine-side helpers: value implementations of the engine object interfaces and a synthetic demo
 * engine.
 */
package ca.gc.cra.pulse.infrastructure.engine;
