/**
 * End-to-end consumer pipeline for one engine run.
 */
package ca.gc.cra.pulse.application.pipeline;
