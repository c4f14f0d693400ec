/**
 * Input validation for configuration and CLI values.
 */
package ca.gc.cra.pulse.validation;
