/**
 * Block rule storage and enforcement for IP, endpoint, and pattern rules.
 * <p><strong>Concurrency:</strong> Evaluations share a read lock; mutations take the write lock with a bounded wait.</p>
 */
package ca.gc.cra.sentinel.application.block;
