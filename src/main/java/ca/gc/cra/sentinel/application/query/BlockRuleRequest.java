package ca.gc.cra.sentinel.application.query;

import ca.gc.cra.sentinel.domain.block.BlockRule;
import ca.gc.cra.sentinel.domain.block.EndpointBlockRule;
import ca.gc.cra.sentinel.domain.block.IpBlockRule;
import ca.gc.cra.sentinel.domain.block.PatternBlockRule;
import ca.gc.cra.sentinel.domain.block.PatternField;
import ca.gc.cra.sentinel.domain.block.RuleKind;
import ca.gc.cra.sentinel.validation.Net;
import ca.gc.cra.sentinel.validation.Strings;
import java.time.Instant;

/**
 * Untrusted request to install a block rule, as received from an operator surface.
 *
 * @param kind {@code ip}, {@code endpoint} or {@code pattern}
 * @param value address, path pattern or match value depending on {@code kind}
 * @param method HTTP method for endpoint rules; blank means {@code ALL}
 * @param field pattern field for pattern rules
 * @param reason operator supplied reason
 * @param createdBy opaque identity of the actor
 * @since 0.1.0
 */
public record BlockRuleRequest(
    String kind, String value, String method, String field, String reason, String createdBy) {

  /**
   * Validates the request and builds the rule.
   *
   * @param createdAt installation time
   * @return rule ready for the store
   * @throws IllegalArgumentException when a field is missing or malformed
   */
  public BlockRule toRule(Instant createdAt) {
    RuleKind ruleKind = RuleKind.fromWire(kind);
    String target = Strings.requireNonBlank("value", value);
    String actor = createdBy == null || createdBy.isBlank() ? "anonymous" : createdBy.trim();
    String why = reason == null ? "" : reason.trim();
    return switch (ruleKind) {
      case IP -> new IpBlockRule(Net.canonicalIp(target), why, createdAt, actor);
      case ENDPOINT -> new EndpointBlockRule(method, target.trim(), why, createdAt, actor);
      case PATTERN -> new PatternBlockRule(PatternField.fromWire(field), target, why, createdAt, actor);
    };
  }
}
