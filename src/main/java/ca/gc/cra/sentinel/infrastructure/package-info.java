/**
 * Infrastructure adapters that implement SENTINEL ports against Kafka, OpenTelemetry, the JDK HTTP server,
 * Jackson, and the local filesystem.
 * <p><strong>Role:</strong> Adapter layer on the driven side; the application layer never imports these types.</p>
 */
package ca.gc.cra.sentinel.infrastructure;
