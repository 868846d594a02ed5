/**
 * Ingest → enforce → classify → archive → publish processing of observed exchanges.
 * <p>Work is partitioned by client address so each IP is handled by a single worker in arrival order.
 * Worker threads are named {@code sentinel-live-*}; replay uses the same pipeline with a bounded-wait
 * submit.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sentinel.application.pipeline;
