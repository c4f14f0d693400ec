/**
 * Logging helpers shared across the pipeline.
 */
package ca.gc.cra.pulse.logging;
