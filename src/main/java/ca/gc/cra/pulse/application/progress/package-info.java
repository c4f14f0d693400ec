/**
 * Progress-row layout for collected tests.
 */
package ca.gc.cra.pulse.application.progress;
