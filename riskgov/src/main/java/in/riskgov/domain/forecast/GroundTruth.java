package in.riskgov.domain.forecast;

import java.time.Instant;

/**
 * Realised value for an earlier forecast, matched by timestamp.
 */
public record GroundTruth(Instant timestamp, double observedValue) {
}
