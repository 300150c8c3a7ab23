package in.riskgov.infrastructure.metrics;

import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.acceptance.PostureTransition;
import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.governance.LifecycleStatus;
import in.riskgov.domain.governance.SequentialDecision;

/**
 * Telemetry sink injected into every engine component.
 *
 * Implementations can publish to Prometheus or discard. Labels stay low-cardinality:
 * posture, guard, reason and decision names only, never per-order or per-forecast identifiers.
 */
public interface RiskMetrics {

    /**
     * Record the posture a cycle ended in.
     */
    void recordDecision(Posture posture);

    /**
     * Record a posture transition.
     */
    void recordTransition(PostureTransition transition);

    /**
     * Record a guard breach.
     *
     * @param hard true for a hard-threshold breach, false for soft-only
     */
    void recordGuardViolation(GuardKind guard, boolean hard);

    /**
     * Record a cycle whose notional was forced to zero.
     */
    void recordBlock(BlockReason reason);

    /**
     * Record a cycle that exceeded its budget and returned the previous decision.
     */
    void recordStaleDecision();

    /**
     * Update calibration gauges.
     */
    void updateCalibration(double currentAlpha, double coverageEma);

    /**
     * Update uncertainty gauges.
     */
    void updateUncertainty(double kappa, double kappaPlus);

    void observeLatency(double latencyMs);

    void observeSurprisal(double surprisal);

    void observeRelativeWidth(double relativeWidth);

    /**
     * Record a sequential test outcome.
     */
    void recordGovernanceDecision(SequentialDecision decision);

    /**
     * Record an alpha allocation and the ledger total after it.
     */
    void recordAlphaSpend(double amount, double cumulative);

    /**
     * Record a test that could not be armed because the budget was exhausted.
     */
    void recordAlphaDenied();

    void recordLifecycleTransition(LifecycleStatus to);

    /**
     * Record the outcome of one snapshot write attempt.
     */
    void recordSnapshotWrite(boolean success);
}
