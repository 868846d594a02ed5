package ca.gc.cra.sentinel.domain.block;

import java.util.Objects;

/**
 * Identifier returned by rule additions: kind plus discriminating key.
 *
 * @param kind rule family
 * @param key discriminating key within the family
 * @since 0.1.0
 */
public record RuleId(RuleKind kind, String key) {
  public RuleId {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(key, "key");
  }

  @Override
  public String toString() {
    return kind.wireName() + ':' + key;
  }
}
