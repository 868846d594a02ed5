package ca.gc.cra.sentinel.application.detect;

/**
 * Lifetime classifier counters.
 *
 * @param requestsAnalyzed entries classified
 * @param tunnelsDetected detections emitted
 * @param beaconsDetected detections where the beaconing indicator fired
 * @since 0.1.0
 */
public record ClassifierStatistics(long requestsAnalyzed, long tunnelsDetected, long beaconsDetected) {}
