package in.riskgov.infrastructure.metrics;

import in.riskgov.domain.acceptance.GuardKind;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.acceptance.PostureTransition;
import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.governance.LifecycleStatus;
import in.riskgov.domain.governance.SequentialDecision;

/**
 * Discards everything. Used when telemetry is switched off.
 */
public final class NoOpRiskMetrics implements RiskMetrics {

    public static final NoOpRiskMetrics INSTANCE = new NoOpRiskMetrics();

    private NoOpRiskMetrics() {}

    @Override public void recordDecision(Posture posture) {}
    @Override public void recordTransition(PostureTransition transition) {}
    @Override public void recordGuardViolation(GuardKind guard, boolean hard) {}
    @Override public void recordBlock(BlockReason reason) {}
    @Override public void recordStaleDecision() {}
    @Override public void updateCalibration(double currentAlpha, double coverageEma) {}
    @Override public void updateUncertainty(double kappa, double kappaPlus) {}
    @Override public void observeLatency(double latencyMs) {}
    @Override public void observeSurprisal(double surprisal) {}
    @Override public void observeRelativeWidth(double relativeWidth) {}
    @Override public void recordGovernanceDecision(SequentialDecision decision) {}
    @Override public void recordAlphaSpend(double amount, double cumulative) {}
    @Override public void recordAlphaDenied() {}
    @Override public void recordLifecycleTransition(LifecycleStatus to) {}
    @Override public void recordSnapshotWrite(boolean success) {}
}
