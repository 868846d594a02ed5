package ca.gc.cra.sentinel.api;

/**
 * Process status of the {@code sentinel} commands. Automation around {@code serve} and {@code replay} reacts to
 * these values rather than to log text.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0, "completed"),
  /** Unknown command, malformed {@code key=value}, or an out-of-range setting. */
  INVALID_ARGS(2, "invalid arguments"),
  /** A capture, rule file, or socket could not be read or bound. */
  IO_ERROR(3, "I/O failure"),
  /** The YAML configuration or indicator rules were malformed. */
  CONFIG_ERROR(4, "configuration error"),
  RUNTIME_FAILURE(5, "unexpected failure"),
  /** SIGINT or thread interruption while waiting. */
  INTERRUPTED(130, "interrupted");

  private final int code;
  private final String description;

  ExitCode(int code, String description) {
    this.code = code;
    this.description = description;
  }

  public int code() {
    return code;
  }

  public boolean failed() {
    return this != SUCCESS;
  }

  /** Short phrase for the final status line, e.g. {@code "I/O failure"}. */
  public String description() {
    return description;
  }
}
