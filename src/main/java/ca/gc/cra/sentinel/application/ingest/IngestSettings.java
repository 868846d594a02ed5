package ca.gc.cra.sentinel.application.ingest;

/**
 * Ingest tuning.
 *
 * @param bodyCapBytes maximum stored bytes per body; larger bodies are truncated
 * @param trustForwardedHeaders honour {@code X-Forwarded-For} and {@code X-Real-IP} when resolving the client
 * @since 0.1.0
 */
public record IngestSettings(int bodyCapBytes, boolean trustForwardedHeaders) {
  public static final int DEFAULT_BODY_CAP_BYTES = 10_000;

  public IngestSettings {
    if (bodyCapBytes < 0) {
      throw new IllegalArgumentException("bodyCapBytes must not be negative");
    }
  }

  public static IngestSettings defaults() {
    return new IngestSettings(DEFAULT_BODY_CAP_BYTES, true);
  }
}
