package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureFormatException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Parses closed traffic captures (HTTP-archive compatible documents).
 *
 * @since 0.1.0
 */
public interface CaptureReader {
  /**
   * Reads one capture document. Malformed entries are skipped and reported in {@link Capture#warnings()}.
   *
   * @param in document stream; not closed by this method
   * @return parsed capture in document order
   * @throws CaptureFormatException when the document itself is malformed
   * @throws IOException when the stream cannot be read
   */
  Capture read(InputStream in) throws IOException;
}
