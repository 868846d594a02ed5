package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.events.MonitorEvent;

/**
 * Single ingress of the broadcast bus.
 *
 * <p>Implementations must never block the caller on slow consumers.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface EventPublisher {
  /**
   * Publishes an event to every current subscriber.
   *
   * @param event event to broadcast; must not be {@code null}
   */
  void publish(MonitorEvent event);
}
