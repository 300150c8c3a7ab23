package in.riskgov.domain.governance;

import java.time.Instant;

/**
 * One registered policy variant. Records are replaced, never mutated or deleted.
 */
public record PolicyRecord(
    String policyId,
    String version,
    LifecycleStatus lifecycleStatus,
    RollingMetrics rollingMetrics,
    Instant createdAt,
    Instant promotedAt
) {
    /**
     * Move to {@code status}. Only promotions stamp {@code promotedAt}; terminal
     * transitions keep the last promotion time.
     */
    public PolicyRecord withStatus(LifecycleStatus status, Instant at) {
        Instant promoted = status.isTerminal() ? promotedAt : at;
        return new PolicyRecord(policyId, version, status, rollingMetrics, createdAt, promoted);
    }

    public PolicyRecord withMetrics(RollingMetrics metrics) {
        return new PolicyRecord(policyId, version, lifecycleStatus, metrics, createdAt, promotedAt);
    }
}
