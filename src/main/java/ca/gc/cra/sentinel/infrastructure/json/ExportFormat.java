package ca.gc.cra.sentinel.infrastructure.json;

import java.util.Locale;

/** Formats supported when exporting recent logs. */
public enum ExportFormat {
  JSON("application/json", "json"),
  CSV("text/csv", "csv"),
  HAR("application/json", "har");

  private final String contentType;
  private final String extension;

  ExportFormat(String contentType, String extension) {
    this.contentType = contentType;
    this.extension = extension;
  }

  public String contentType() {
    return contentType;
  }

  public String extension() {
    return extension;
  }

  public static ExportFormat fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      return JSON;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (ExportFormat format : values()) {
      if (format.name().equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("format must be json, csv, or har (was " + raw + ")");
  }
}
