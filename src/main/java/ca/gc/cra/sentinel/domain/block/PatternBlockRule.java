package ca.gc.cra.sentinel.domain.block;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Denies requests where a named field matches {@code value}. Values containing {@code *} or {@code ?} are globs
 * anchored to the whole field; other values match as case-insensitive substrings.
 *
 * @param field inspected request field
 * @param value glob or substring
 * @param reason optional reason
 * @param createdAt creation or refresh time
 * @param createdBy actor identity token
 */
public record PatternBlockRule(PatternField field, String value, String reason, Instant createdAt, String createdBy)
    implements BlockRule {
  public PatternBlockRule {
    field = Objects.requireNonNull(field, "field");
    value = Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("pattern value must not be blank");
    }
    reason = reason == null ? "" : reason;
    createdAt = Objects.requireNonNull(createdAt, "createdAt");
    createdBy = createdBy == null ? "" : createdBy;
  }

  /** Key in the form {@code field:value}; the value is lower-cased because matching ignores case. */
  public static String keyOf(PatternField field, String value) {
    return Objects.requireNonNull(field, "field").wireName() + ':'
        + Objects.requireNonNull(value, "value").toLowerCase(Locale.ROOT);
  }

  @Override
  public RuleKind kind() {
    return RuleKind.PATTERN;
  }

  @Override
  public String key() {
    return keyOf(field, value);
  }

  @Override
  public PatternBlockRule refreshed(String reason, Instant createdAt, String createdBy) {
    return new PatternBlockRule(field, value, reason, createdAt, createdBy);
  }
}
