/**
 * Application layer orchestration for SENTINEL.
 * <p><strong>Role:</strong> Hosts the ingest, enforcement, classification, broadcast, statistics, and timeline use
 * cases plus the ports they depend on.</p>
 * <p><strong>Concurrency:</strong> The pipeline partitions work by source IP; the bus isolates subscribers behind
 * bounded queues; shared state documents its own locking.</p>
 * <p><strong>Metrics:</strong> Emits namespaces including {@code pipeline.*}, {@code bus.*}, {@code classifier.*},
 * {@code block.*}, and {@code stats.*}.</p>
 */
package ca.gc.cra.sentinel.application;
