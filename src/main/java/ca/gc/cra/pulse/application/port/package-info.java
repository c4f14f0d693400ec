/**
 * Ports connecting PULSE use cases to codecs, engines, metrics and observers.
 * <p><strong>Role:</strong> Application layer seams implemented by infrastructure adapters.</p>
 */
package ca.gc.cra.pulse.application.port;
