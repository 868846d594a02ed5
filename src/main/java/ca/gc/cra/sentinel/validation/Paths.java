package ca.gc.cra.sentinel.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Path validation for capture files and indicator rule files handed to SENTINEL on the command line.
 *
 * @since 0.1.0
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Normalizes {@code path} and ensures it names an existing, readable regular file within {@code maxBytes}.
   *
   * @param path candidate file
   * @param maxBytes upper bound on the file size; non-positive disables the check
   * @return real path of the file
   * @throws IllegalArgumentException when the path is malformed, missing, unreadable, or too large
   */
  public static Path validateReadableFile(Path path, long maxBytes) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    try {
      Path real = normalized.toRealPath();
      if (!Files.isRegularFile(real, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("path is not a regular file: " + real);
      }
      if (!Files.isReadable(real)) {
        throw new IllegalArgumentException("file is not readable: " + real);
      }
      if (maxBytes > 0 && Files.size(real) > maxBytes) {
        throw new IllegalArgumentException("file " + real + " exceeds " + maxBytes + " bytes");
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate file " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
