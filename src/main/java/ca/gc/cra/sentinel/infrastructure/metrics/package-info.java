/**
 * Metrics adapters bridging SENTINEL's {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Instruments are created lazily and cached; updates are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code ingest.*}, {@code pipeline.*}, {@code classifier.*},
 * {@code block.*}, {@code bus.*}, {@code stats.*} and {@code archive.*}.</p>
 * <p><strong>Security:</strong> Only metric keys are exported; traffic content never becomes an attribute.</p>
 */
package ca.gc.cra.sentinel.infrastructure.metrics;
