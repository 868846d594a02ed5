package ca.gc.cra.sentinel.domain.capture;

import java.io.IOException;

/**
 * Raised when a capture document as a whole cannot be interpreted (not JSON, or no {@code log.entries} array).
 * Problems confined to single entries are reported as warnings on the {@link Capture} instead.
 *
 * @since 0.1.0
 */
public class CaptureFormatException extends IOException {
  private static final long serialVersionUID = 1L;

  public CaptureFormatException(String message) {
    super(message);
  }

  public CaptureFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
