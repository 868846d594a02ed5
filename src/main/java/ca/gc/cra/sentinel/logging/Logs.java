package ca.gc.cra.sentinel.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers for writing observed traffic values into log lines.
 * <p><strong>Why:</strong> Request paths, user agents, and bodies are attacker controlled; log lines must stay
 * bounded, single-line, and free of credentials.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding ignores malformed input so truncating mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer kept = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return kept + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Escapes control characters (CR and LF included) as {@code \\uXXXX} and then truncates, so an observed value
   * cannot forge extra log lines.
   *
   * @param value observed value; {@code null} results in {@code "<null>"}
   * @param maxBytes byte budget applied after escaping
   * @return single-line, bounded rendering of {@code value}
   */
  public static String printable(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder escaped = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isISOControl(c)) {
        if (escaped == null) {
          escaped = new StringBuilder(value.length() + 8).append(value, 0, i);
        }
        escaped.append(String.format("\\u%04x", (int) c));
      } else if (escaped != null) {
        escaped.append(c);
      }
    }
    return truncate(escaped == null ? value : escaped.toString(), maxBytes);
  }

  /**
   * Returns the placeholder that replaces sensitive header values.
   *
   * @param value ignored original value
   * @return {@code [REDACTED]}
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Reports whether a value is the redaction placeholder, i.e. the original content is no longer available.
   *
   * @param value value to test
   * @return {@code true} for {@code [REDACTED]}
   */
  public static boolean isRedacted(String value) {
    return REDACTED_PLACEHOLDER.equals(value);
  }
}
