package ca.gc.cra.sentinel.application.stream;

/** Lifecycle of a live stream connection: {@code DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED}. */
public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
