/**
 * In-process broadcast of monitor events to live subscribers.
 * <p><strong>Concurrency:</strong> Publishing never blocks; each subscriber drains its own bounded queue on a
 * dedicated pump, and a subscriber that falls behind loses its oldest queued events.</p>
 * <p><strong>Metrics:</strong> {@code bus.event.published}, {@code bus.event.dropped}, {@code bus.subscriber.*}.</p>
 */
package ca.gc.cra.sentinel.application.bus;
