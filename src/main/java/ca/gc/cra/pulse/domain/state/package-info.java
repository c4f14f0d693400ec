/**
 * Classification vocabulary for per-test run state.
 */
package ca.gc.cra.pulse.domain.state;
