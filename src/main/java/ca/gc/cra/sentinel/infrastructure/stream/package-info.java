/**
 * Server-sent events plumbing: the sink that writes bus events to an open response and the client transport
 * used by {@code watch} to follow a remote instance.
 */
package ca.gc.cra.sentinel.infrastructure.stream;
