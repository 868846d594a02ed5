/**
 * Core domain model for SENTINEL ingest → classify → broadcast pipelines.
 * <p><strong>Role:</strong> Immutable records describing observed exchanges, verdicts, block rules, live events,
 * statistics, and reconstructed capture timelines without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across worker threads.</p>
 * <p><strong>Security:</strong> Payload-bearing types hold truncated, redacted copies of observed traffic.</p>
 */
package ca.gc.cra.sentinel.domain;
