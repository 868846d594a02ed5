package ca.gc.cra.sentinel.infrastructure.capture;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureEntry;
import ca.gc.cra.sentinel.domain.capture.CaptureFormatException;
import ca.gc.cra.sentinel.testutil.CaptureFixtures;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HarCaptureReaderTest {
  private final HarCaptureReader reader = new HarCaptureReader();

  @Test
  void readsEntriesAndSkipsIncompleteOnes(@TempDir Path dir) throws IOException {
    Capture capture = reader.read(CaptureFixtures.writeSample(dir));

    assertEquals(2, capture.entries().size());
    CaptureEntry first = capture.entries().get(0);
    assertEquals(0, first.index());
    assertEquals("GET", first.method());
    assertEquals("Mozilla/5.0", first.requestHeaders().first("user-agent").orElseThrow());
    assertEquals(2048L, first.responseBodySize());
    assertEquals(-1d, first.timings().get("blocked"));
    assertFalse(capture.entries().get(1).timings().containsKey("comment"));
    assertEquals(1, capture.warnings().size());
    assertTrue(capture.warnings().get(0).startsWith("entry 2 skipped"));
  }

  @Test
  void reportsNonNumericTimings() throws IOException {
    String har = "{\"log\":{\"entries\":[{\"request\":{\"method\":\"GET\",\"url\":\"http://a/\"},"
        + "\"response\":{\"status\":204},\"timings\":{\"wait\":\"slow\",\"receive\":3}}]}}";

    Capture capture = reader.read(stream(har));

    assertEquals(1, capture.entries().get(0).timings().size());
    assertEquals(1, capture.warnings().size());
  }

  @Test
  void readsRecordedBodiesAndDecodesBase64Content() throws IOException {
    String har = "{\"log\":{\"entries\":["
        + "{\"request\":{\"method\":\"POST\",\"url\":\"http://a/upload\",\"bodySize\":5,"
        + "\"postData\":{\"mimeType\":\"text/plain\",\"text\":\"hello\"}},"
        + "\"response\":{\"status\":200,\"content\":{\"size\":3,\"encoding\":\"base64\",\"text\":\"AP8B\"}}},"
        + "{\"request\":{\"method\":\"GET\",\"url\":\"http://a/img\"},"
        + "\"response\":{\"status\":200,\"content\":{\"size\":40,\"encoding\":\"base64\",\"text\":\"%%%\"}}}"
        + "]}}";

    Capture capture = reader.read(stream(har));

    CaptureEntry upload = capture.entries().get(0);
    assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), upload.requestBody());
    assertArrayEquals(new byte[] {0, (byte) 0xFF, 1}, upload.responseBody());
    CaptureEntry image = capture.entries().get(1);
    assertEquals(0, image.responseBody().length);
    assertEquals(40L, image.declaredResponseSize());
    assertEquals(1, capture.warnings().size());
    assertTrue(capture.warnings().get(0).contains("response.content.text is not valid base64"));
  }

  @Test
  void rejectsDocumentsWithoutEntries() {
    assertThrows(CaptureFormatException.class, () -> reader.read(stream("[1,2]")));
    assertThrows(CaptureFormatException.class, () -> reader.read(stream("{\"log\":{}}")));
    assertThrows(CaptureFormatException.class, () -> reader.read(stream("{not json")));
  }

  private static ByteArrayInputStream stream(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }
}
