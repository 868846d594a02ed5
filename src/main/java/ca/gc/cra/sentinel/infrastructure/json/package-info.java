/**
 * Jackson streaming codecs for the wire formats: observation intake, API envelopes, stream events, and log
 * exports (JSON, CSV, HAR).
 * <p><strong>Concurrency:</strong> Codecs are stateless and share one {@code JsonFactory}.</p>
 */
package ca.gc.cra.sentinel.infrastructure.json;
