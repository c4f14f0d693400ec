/**
 * Configuration loading (defaults, YAML, CLI merge) and the composition root.
 */
package ca.gc.cra.pulse.config;
