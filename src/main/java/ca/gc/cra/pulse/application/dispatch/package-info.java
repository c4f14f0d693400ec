/**
 * Frame recognition, typed callback binding and run-phase hold-back.
 */
package ca.gc.cra.pulse.application.dispatch;
