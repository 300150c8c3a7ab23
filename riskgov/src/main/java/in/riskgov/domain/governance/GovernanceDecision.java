package in.riskgov.domain.governance;

import java.time.Instant;

/**
 * Outcome of feeding one metric to a governance test.
 *
 * @param alphaSpent significance allocated to the test that produced this decision, 0 if none was granted
 */
public record GovernanceDecision(
    String policyId,
    String testId,
    SequentialDecision decision,
    double llr,
    int nSamples,
    double alphaSpent,
    Instant timestamp
) {
}
