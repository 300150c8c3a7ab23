package in.riskgov.domain.governance;

import java.time.Instant;

/**
 * Audit trail entry for a lifecycle change.
 */
public record LifecycleEvent(
    String policyId,
    String version,
    LifecycleStatus from,
    LifecycleStatus to,
    Instant at,
    String reason
) {
}
