package ca.gc.cra.sentinel.application.query;

import java.util.Objects;

/**
 * Outcome of a pull operation: either a value or an {@link ErrorCode} with a message.
 *
 * @param <T> value type
 * @param value result value; {@code null} on failure
 * @param error failure category; {@code null} on success
 * @param message human readable failure detail; empty on success
 * @since 0.1.0
 */
public record QueryResult<T>(T value, ErrorCode error, String message) {
  public QueryResult {
    if ((value == null) == (error == null)) {
      throw new IllegalArgumentException("exactly one of value or error must be set");
    }
    message = message == null ? "" : message;
  }

  public static <T> QueryResult<T> ok(T value) {
    return new QueryResult<>(Objects.requireNonNull(value, "value"), null, "");
  }

  public static <T> QueryResult<T> failure(ErrorCode error, String message) {
    return new QueryResult<>(null, Objects.requireNonNull(error, "error"), message);
  }

  public boolean isOk() {
    return error == null;
  }
}
