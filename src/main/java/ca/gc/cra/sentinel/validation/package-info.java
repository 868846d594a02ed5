/**
 * Input validation helpers shared by configuration, CLI, and pull-interface adapters.
 * <p><strong>Concurrency:</strong> Stateless utilities; safe for concurrent use.</p>
 * <p><strong>Security:</strong> Rejects control characters, malformed addresses, and unreadable paths before
 * adapters allocate sockets, files, or Kafka producers.</p>
 */
package ca.gc.cra.sentinel.validation;
