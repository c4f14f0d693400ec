/**
 * Error taxonomy for the reporting pipeline.
 * <p>Every error kind degrades to a logged, recoverable state; none aborts a test run.</p>
 */
package ca.gc.cra.pulse.domain.error;
