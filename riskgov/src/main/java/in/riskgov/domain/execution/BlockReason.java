package in.riskgov.domain.execution;

import in.riskgov.domain.acceptance.GuardKind;

/**
 * Why a cycle produced zero notional.
 */
public enum BlockReason {
    COVERAGE_EMA,
    COVERAGE_MISS_STREAK,
    LATENCY_P95,
    SURPRISAL_P95,
    RELATIVE_INTERVAL_WIDTH,
    KAPPA,
    KAPPA_PLUS,
    POSTURE_BLOCK,
    POLICY_STAGE,
    STALE_DECISION;

    public static BlockReason forGuard(GuardKind guard) {
        return valueOf(guard.name());
    }

    public String metricLabel() {
        return name().toLowerCase();
    }
}
