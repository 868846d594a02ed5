package ca.gc.cra.sentinel.domain.block;

import java.time.Instant;

/**
 * <strong>What:</strong> Standing deny directive enforced against every ingested entry.
 * <p><strong>Role:</strong> Sealed domain sum type; each variant defines its own discriminating key which is unique
 * per {@link RuleKind} inside the rule store.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface BlockRule permits IpBlockRule, EndpointBlockRule, PatternBlockRule {

  RuleKind kind();

  /** Discriminating key; two rules of the same kind with equal keys are the same rule. */
  String key();

  /** Operator supplied reason; empty when none was given. */
  String reason();

  Instant createdAt();

  /** Opaque identity token of the actor that created the rule; empty when unknown. */
  String createdBy();

  /**
   * Returns a copy with refreshed metadata, used when a duplicate add re-asserts an existing rule.
   *
   * @param reason new reason
   * @param createdAt refresh timestamp
   * @param createdBy actor re-asserting the rule
   * @return refreshed rule with the same key
   */
  BlockRule refreshed(String reason, Instant createdAt, String createdBy);

  default RuleId id() {
    return new RuleId(kind(), key());
  }
}
