package ca.gc.cra.sentinel.application.stream;

/**
 * Receives live stream messages and connection state changes from a {@link ConnectionManager}.
 *
 * <p>Callbacks run on transport or scheduler threads and must not block.</p>
 */
public interface StreamListener {
  void onMessage(StreamMessage message);

  default void onStateChange(ConnectionState state) {}
}
