/**
 * Run control: phase tracking, layout recomputation and run summaries.
 */
package ca.gc.cra.pulse.application.control;
