package ca.gc.cra.sentinel.domain.detect;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Classifier verdict for a single log entry.
 * <p><strong>Why:</strong> Carries the evidence trail so analysts can see which indicators fired and how they
 * contributed to the risk score.</p>
 * <p><strong>Role:</strong> Domain value object produced by the classifier; only created when at least one
 * indicator fired.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param detectionId unique identifier of the verdict
 * @param entryId identifier of the referenced {@code LogEntry}
 * @param sourceIp client address of the referenced entry
 * @param detectedAt classification time
 * @param tunnelType suggested covert channel category
 * @param confidence banded certainty
 * @param riskScore clipped score in {@code [0,100]}
 * @param indicators human-readable evidence in firing order; never empty
 * @since 0.1.0
 */
public record TunnelDetection(
    String detectionId,
    String entryId,
    String sourceIp,
    Instant detectedAt,
    TunnelType tunnelType,
    Confidence confidence,
    int riskScore,
    List<String> indicators) {

  /** Upper bound of the risk scale. */
  public static final int MAX_RISK_SCORE = 100;
  /** Lowest score a {@link Confidence#CONFIRMED} verdict may carry (top decile of the scale). */
  public static final int CONFIRMED_FLOOR = 90;

  public TunnelDetection {
    detectionId = Objects.requireNonNull(detectionId, "detectionId");
    entryId = Objects.requireNonNull(entryId, "entryId");
    sourceIp = Objects.requireNonNull(sourceIp, "sourceIp");
    detectedAt = Objects.requireNonNull(detectedAt, "detectedAt");
    tunnelType = Objects.requireNonNullElse(tunnelType, TunnelType.UNKNOWN);
    confidence = Objects.requireNonNull(confidence, "confidence");
    indicators = List.copyOf(Objects.requireNonNull(indicators, "indicators"));
    if (riskScore < 0 || riskScore > MAX_RISK_SCORE) {
      throw new IllegalArgumentException("riskScore must be between 0 and 100 (was " + riskScore + ")");
    }
    if (indicators.isEmpty()) {
      throw new IllegalArgumentException("a detection requires at least one indicator");
    }
    if (confidence == Confidence.CONFIRMED && riskScore < CONFIRMED_FLOOR) {
      throw new IllegalArgumentException(
          "confirmed detections require riskScore >= " + CONFIRMED_FLOOR + " (was " + riskScore + ")");
    }
  }

  /** Always {@code true}: verdicts exist only for entries where something fired. */
  public boolean detected() {
    return true;
  }
}
