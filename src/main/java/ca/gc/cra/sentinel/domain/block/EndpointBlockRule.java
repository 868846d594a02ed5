package ca.gc.cra.sentinel.domain.block;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Denies requests whose method and path match. The method is either an exact HTTP method or {@code ALL}; the
 * pattern is a glob ({@code *}, {@code ?}) or a literal path prefix.
 *
 * @param method upper-case HTTP method or {@link #ALL_METHODS}
 * @param pattern path glob or prefix
 * @param reason optional reason
 * @param createdAt creation or refresh time
 * @param createdBy actor identity token
 */
public record EndpointBlockRule(String method, String pattern, String reason, Instant createdAt, String createdBy)
    implements BlockRule {
  public static final String ALL_METHODS = "ALL";

  public EndpointBlockRule {
    method = normalizeMethod(method);
    pattern = Objects.requireNonNull(pattern, "pattern").trim();
    if (pattern.isEmpty()) {
      throw new IllegalArgumentException("endpoint pattern must not be blank");
    }
    reason = reason == null ? "" : reason;
    createdAt = Objects.requireNonNull(createdAt, "createdAt");
    createdBy = createdBy == null ? "" : createdBy;
  }

  /**
   * Builds the discriminating key for a method/pattern pair so callers can remove rules without an instance.
   *
   * @param method HTTP method or {@code ALL}; blank means {@code ALL}
   * @param pattern path pattern
   * @return key in the form {@code METHOD pattern}
   */
  public static String keyOf(String method, String pattern) {
    return normalizeMethod(method) + ' ' + Objects.requireNonNull(pattern, "pattern").trim();
  }

  @Override
  public RuleKind kind() {
    return RuleKind.ENDPOINT;
  }

  @Override
  public String key() {
    return keyOf(method, pattern);
  }

  public boolean allMethods() {
    return ALL_METHODS.equals(method);
  }

  @Override
  public EndpointBlockRule refreshed(String reason, Instant createdAt, String createdBy) {
    return new EndpointBlockRule(method, pattern, reason, createdAt, createdBy);
  }

  private static String normalizeMethod(String method) {
    if (method == null || method.isBlank()) {
      return ALL_METHODS;
    }
    return method.trim().toUpperCase(Locale.ROOT);
  }
}
