/**
 * Metrics adapters: OpenTelemetry export and a discarding fallback.
 */
package ca.gc.nrc.pyxis.infrastructure.metrics;
