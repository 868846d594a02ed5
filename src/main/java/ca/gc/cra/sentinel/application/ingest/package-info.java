/** Normalization of raw exchanges into log entries: client address resolution, body caps, header redaction. */
package ca.gc.cra.sentinel.application.ingest;
