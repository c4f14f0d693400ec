/**
 * Command-line entry points: {@code run}, {@code replay} and {@code demo-engine}.
 */
package ca.gc.cra.pulse.api;
