/**
 * JDK {@code HttpServer} front end exposing the pull API under {@code /api/network} and the event stream.
 * <p><strong>Concurrency:</strong> Requests run on a bounded daemon pool; stream connections hold a thread each
 * until the subscriber disconnects.</p>
 * <p><strong>Security:</strong> Query parameters and bodies are validated before reaching the query service;
 * error bodies never echo stack traces.</p>
 */
package ca.gc.cra.sentinel.infrastructure.http;
