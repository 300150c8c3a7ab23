package in.riskgov.domain.governance;

import java.time.Instant;

/**
 * Periodic performance observation of a policy variant.
 */
public record PolicyMetric(String policyId, Instant timestamp, double metricValue) {
}
