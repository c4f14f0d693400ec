/**
 * Run-state aggregation: per-test lifecycle records and collection bookkeeping.
 */
package ca.gc.cra.pulse.application.state;
