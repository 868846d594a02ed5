package ca.gc.cra.sentinel.domain.block;

import java.time.Instant;
import java.util.Objects;

/**
 * Denies every exchange from a single client address.
 *
 * @param ip client address literal
 * @param reason optional reason
 * @param createdAt creation or refresh time
 * @param createdBy actor identity token
 */
public record IpBlockRule(String ip, String reason, Instant createdAt, String createdBy) implements BlockRule {
  public IpBlockRule {
    ip = Objects.requireNonNull(ip, "ip").trim();
    if (ip.isEmpty()) {
      throw new IllegalArgumentException("ip must not be blank");
    }
    reason = reason == null ? "" : reason;
    createdAt = Objects.requireNonNull(createdAt, "createdAt");
    createdBy = createdBy == null ? "" : createdBy;
  }

  @Override
  public RuleKind kind() {
    return RuleKind.IP;
  }

  @Override
  public String key() {
    return ip;
  }

  @Override
  public IpBlockRule refreshed(String reason, Instant createdAt, String createdBy) {
    return new IpBlockRule(ip, reason, createdAt, createdBy);
  }
}
