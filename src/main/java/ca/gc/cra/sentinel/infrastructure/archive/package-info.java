/**
 * Kafka producer adapter that archives analyzed entries as JSON records keyed by source IP.
 * <p><strong>Metrics:</strong> {@code archive.kafka.sent} and {@code archive.kafka.failed}; pipeline-side failures count as
 * {@code archive.failed}.</p>
 */
package ca.gc.cra.sentinel.infrastructure.archive;
