package ca.gc.cra.sentinel.domain.block;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of block enforcement for one entry.
 *
 * @since 0.1.0
 */
public sealed interface BlockDecision permits BlockDecision.Allow, BlockDecision.Deny {

  static BlockDecision allow() {
    return Allow.INSTANCE;
  }

  static BlockDecision deny(BlockRule rule) {
    return new Deny(rule);
  }

  boolean denied();

  /** Rule responsible for a deny; empty for allows. */
  Optional<BlockRule> matchedRule();

  /** No rule matched. */
  record Allow() implements BlockDecision {
    private static final Allow INSTANCE = new Allow();

    @Override
    public boolean denied() {
      return false;
    }

    @Override
    public Optional<BlockRule> matchedRule() {
      return Optional.empty();
    }
  }

  /**
   * The first matching rule in evaluation order.
   *
   * @param rule matched rule
   */
  record Deny(BlockRule rule) implements BlockDecision {
    public Deny {
      Objects.requireNonNull(rule, "rule");
    }

    @Override
    public boolean denied() {
      return true;
    }

    @Override
    public Optional<BlockRule> matchedRule() {
      return Optional.of(rule);
    }
  }
}
