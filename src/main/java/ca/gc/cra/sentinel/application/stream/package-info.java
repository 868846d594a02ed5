/**
 * Client-side connection management for following a remote event stream: reconnect backoff, heartbeats,
 * and idle detection over a pluggable transport.
 */
package ca.gc.cra.sentinel.application.stream;
