package ca.gc.cra.sentinel.application.detect;

import ca.gc.cra.sentinel.domain.detect.TunnelType;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one indicator check that fired.
 *
 * @param check name of the firing check
 * @param weight contribution to the risk score
 * @param evidence human-readable evidence, in the order it was found
 * @param suggestedType covert channel category suggested by the check
 * @since 0.1.0
 */
public record IndicatorHit(String check, int weight, List<String> evidence, TunnelType suggestedType) {
  public IndicatorHit {
    Objects.requireNonNull(check, "check");
    evidence = List.copyOf(Objects.requireNonNull(evidence, "evidence"));
    suggestedType = Objects.requireNonNullElse(suggestedType, TunnelType.UNKNOWN);
    if (weight < 0) {
      throw new IllegalArgumentException("weight must not be negative");
    }
    if (evidence.isEmpty()) {
      throw new IllegalArgumentException("a hit requires evidence");
    }
  }
}
