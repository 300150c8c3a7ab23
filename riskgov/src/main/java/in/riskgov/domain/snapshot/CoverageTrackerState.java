package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Hit window (oldest first, 1 = covered) and EMA of the coverage compliance tracker.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoverageTrackerState(int[] window, double ema, long observations) {
}
