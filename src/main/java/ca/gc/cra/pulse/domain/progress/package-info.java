/**
 * Progress layout model: display groups sized to a rendering surface.
 */
package ca.gc.cra.pulse.domain.progress;
