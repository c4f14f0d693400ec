/**
 * Engine-facing interfaces: the objects and callbacks a test-execution engine supplies.
 * <p><strong>Role:</strong> Ports on the producer side; engines adapt their native objects to these.</p>
 */
package ca.gc.cra.pulse.application.port.engine;
