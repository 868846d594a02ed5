package ca.gc.cra.sentinel.domain.traffic;

import java.util.Objects;

/**
 * Single HTTP header as observed on the wire. Names keep their original case.
 *
 * @param name header name; never {@code null}
 * @param value header value; {@code null} normalizes to an empty string
 * @since 0.1.0
 */
public record Header(String name, String value) {
  public Header {
    name = Objects.requireNonNull(name, "name");
    value = value == null ? "" : value;
  }
}
