package ca.gc.cra.sentinel.application.detect;

import ca.gc.cra.sentinel.domain.detect.Confidence;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;

/**
 * Lower score bounds of the confidence levels above {@code low}.
 *
 * @param medium first score rated {@code medium}
 * @param high first score rated {@code high}
 * @param confirmed first score rated {@code confirmed}; never below 90
 * @since 0.1.0
 */
public record ConfidenceBands(int medium, int high, int confirmed) {
  public ConfidenceBands {
    if (medium <= 0 || medium >= high || high >= confirmed) {
      throw new IllegalArgumentException(
          "bands must satisfy 0 < medium < high < confirmed (was " + medium + ", " + high + ", " + confirmed + ")");
    }
    if (confirmed < TunnelDetection.CONFIRMED_FLOOR || confirmed > TunnelDetection.MAX_RISK_SCORE) {
      throw new IllegalArgumentException("bands.confirmed must be between 90 and 100 (was " + confirmed + ")");
    }
  }

  public static ConfidenceBands defaults() {
    return new ConfidenceBands(40, 70, 90);
  }

  public Confidence rate(int riskScore) {
    if (riskScore >= confirmed) {
      return Confidence.CONFIRMED;
    }
    if (riskScore >= high) {
      return Confidence.HIGH;
    }
    if (riskScore >= medium) {
      return Confidence.MEDIUM;
    }
    return Confidence.LOW;
  }
}
