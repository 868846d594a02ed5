package ca.gc.cra.sentinel.application.stream;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Port for opening one live stream session against a running monitor.
 *
 * @since 0.1.0
 */
public interface StreamTransport {
  /**
   * Opens a session. Returns once the server accepted the stream; messages then arrive on a transport thread.
   *
   * @param onMessage invoked for every decoded envelope
   * @param onClosed invoked once when the session ends for any reason other than {@link Session#close()}
   * @return open session
   * @throws IOException when the connection cannot be established
   */
  Session open(Consumer<StreamMessage> onMessage, Consumer<Throwable> onClosed) throws IOException;

  /** An established stream. */
  interface Session extends AutoCloseable {
    /**
     * Sends the client heartbeat ({@code {type:"ping"}}).
     *
     * @throws IOException when the heartbeat cannot be delivered
     */
    void ping() throws IOException;

    @Override
    void close();
  }
}
