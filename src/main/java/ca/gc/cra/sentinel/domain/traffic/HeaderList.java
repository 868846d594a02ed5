package ca.gc.cra.sentinel.domain.traffic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Ordered header collection where names may repeat.
 * <p><strong>Why:</strong> HTTP allows repeated header names and the order carries investigative value, so a
 * {@link java.util.Map} would lose information.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @param entries headers in observed order
 * @since 0.1.0
 */
public record HeaderList(List<Header> entries) {
  private static final HeaderList EMPTY = new HeaderList(List.of());

  public HeaderList {
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
  }

  /**
   * Returns the shared empty header list.
   *
   * @return empty list
   */
  public static HeaderList empty() {
    return EMPTY;
  }

  /**
   * Builds a header list from alternating name/value arguments.
   *
   * @param namesAndValues {@code name1, value1, name2, value2, ...}
   * @return header list preserving argument order
   * @throws IllegalArgumentException when an odd number of arguments is supplied
   */
  public static HeaderList of(String... namesAndValues) {
    if (namesAndValues == null || namesAndValues.length == 0) {
      return EMPTY;
    }
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("headers must be supplied as name/value pairs");
    }
    List<Header> headers = new ArrayList<>(namesAndValues.length / 2);
    for (int i = 0; i < namesAndValues.length; i += 2) {
      headers.add(new Header(namesAndValues[i], namesAndValues[i + 1]));
    }
    return new HeaderList(headers);
  }

  /**
   * Returns the first value for {@code name}, compared case-insensitively.
   *
   * @param name header name
   * @return first matching value, if any
   */
  public Optional<String> first(String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (Header header : entries) {
      if (header.name().equalsIgnoreCase(name)) {
        return Optional.of(header.value());
      }
    }
    return Optional.empty();
  }

  /**
   * Returns every value for {@code name} in observed order.
   *
   * @param name header name, compared case-insensitively
   * @return matching values; empty when absent
   */
  public List<String> values(String name) {
    List<String> values = new ArrayList<>();
    for (Header header : entries) {
      if (header.name().equalsIgnoreCase(name)) {
        values.add(header.value());
      }
    }
    return List.copyOf(values);
  }

  public boolean contains(String name) {
    return first(name).isPresent();
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Returns a copy where headers whose lower-cased name satisfies {@code selector} carry {@code replacement}.
   *
   * @param selector predicate over the lower-cased header name
   * @param replacement value substituted for selected headers
   * @return new header list; {@code this} when nothing was replaced
   */
  public HeaderList replaceValues(Predicate<String> selector, String replacement) {
    Objects.requireNonNull(selector, "selector");
    List<Header> copy = new ArrayList<>(entries.size());
    boolean changed = false;
    for (Header header : entries) {
      if (selector.test(header.name().toLowerCase(Locale.ROOT))) {
        copy.add(new Header(header.name(), replacement));
        changed = true;
      } else {
        copy.add(header);
      }
    }
    return changed ? new HeaderList(copy) : this;
  }
}
