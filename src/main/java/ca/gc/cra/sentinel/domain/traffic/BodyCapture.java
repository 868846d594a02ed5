package ca.gc.cra.sentinel.domain.traffic;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * <strong>What:</strong> Stored prefix of an HTTP body together with the size of the original body.
 * <p><strong>Why:</strong> Bodies are capped at ingest so memory stays bounded while the original size keeps its
 * investigative value.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the content array is copied on the way in and out.</p>
 *
 * @param content stored body bytes (a prefix when truncated)
 * @param size size of the original body in bytes; never smaller than the stored prefix
 * @param truncated {@code true} when {@code content} holds only a prefix of the original body
 * @since 0.1.0
 */
public record BodyCapture(byte[] content, long size, boolean truncated) {
  private static final BodyCapture EMPTY = new BodyCapture(new byte[0], 0L, false);

  public BodyCapture {
    content = content != null ? content.clone() : new byte[0];
    if (size < content.length) {
      throw new IllegalArgumentException("size must be >= stored length (" + content.length + ")");
    }
    if (truncated && size == content.length) {
      throw new IllegalArgumentException("truncated body must report an original size larger than its prefix");
    }
    if (!truncated && size != content.length) {
      throw new IllegalArgumentException("untruncated body size must equal stored length");
    }
  }

  public static BodyCapture empty() {
    return EMPTY;
  }

  /**
   * Captures {@code raw}, keeping at most {@code capBytes} bytes.
   *
   * @param raw original body; {@code null} yields an empty capture
   * @param capBytes maximum stored bytes; must not be negative
   * @return capture whose {@link #size()} is the original length
   */
  public static BodyCapture capture(byte[] raw, int capBytes) {
    if (capBytes < 0) {
      throw new IllegalArgumentException("capBytes must not be negative");
    }
    if (raw == null || raw.length == 0) {
      return EMPTY;
    }
    if (raw.length <= capBytes) {
      return new BodyCapture(raw, raw.length, false);
    }
    return new BodyCapture(Arrays.copyOf(raw, capBytes), raw.length, true);
  }

  /**
   * Captures {@code raw} when it may itself be only part of a larger body, as with bodies recorded by an
   * upstream tool that kept a prefix.
   *
   * @param raw available body bytes; {@code null} yields an empty capture
   * @param capBytes maximum stored bytes; must not be negative
   * @param declaredSize original body size reported alongside {@code raw}; ignored unless larger than
   *     {@code raw.length}
   * @return capture whose {@link #size()} is the larger of the available and declared sizes
   */
  public static BodyCapture capture(byte[] raw, int capBytes, long declaredSize) {
    BodyCapture available = capture(raw, capBytes);
    if (declaredSize <= available.size) {
      return available;
    }
    return new BodyCapture(available.content, declaredSize, true);
  }

  @Override
  public byte[] content() {
    return content.clone();
  }

  public int storedLength() {
    return content.length;
  }

  public boolean isEmpty() {
    return size == 0L;
  }

  /** Decodes the stored prefix as UTF-8; malformed sequences become replacement characters. */
  public String text() {
    return new String(content, StandardCharsets.UTF_8);
  }

  /**
   * Normalized Shannon entropy of the stored bytes in {@code [0,1]} (bits per byte divided by 8).
   *
   * @return entropy, {@code 0} for an empty body
   */
  public double normalizedEntropy() {
    if (content.length == 0) {
      return 0d;
    }
    int[] counts = new int[256];
    for (byte b : content) {
      counts[b & 0xFF]++;
    }
    double entropy = 0d;
    double total = content.length;
    for (int count : counts) {
      if (count == 0) {
        continue;
      }
      double p = count / total;
      entropy -= p * (Math.log(p) / Math.log(2));
    }
    return entropy / 8d;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof BodyCapture other)) {
      return false;
    }
    return size == other.size && truncated == other.truncated && Arrays.equals(content, other.content);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(content);
    result = 31 * result + Long.hashCode(size);
    return 31 * result + Boolean.hashCode(truncated);
  }

  @Override
  public String toString() {
    return "BodyCapture[stored=" + content.length + ", size=" + size + ", truncated=" + truncated + "]";
  }
}
