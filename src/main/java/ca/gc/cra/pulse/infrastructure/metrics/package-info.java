/**
 * OpenTelemetry metrics adapter and its SDK bootstrap; {@code MetricsPort.NO_OP} covers disabled export.
 */
package ca.gc.cra.pulse.infrastructure.metrics;
