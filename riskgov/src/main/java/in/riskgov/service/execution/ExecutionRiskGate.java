package in.riskgov.service.execution;

import in.riskgov.config.GateConfig;
import in.riskgov.domain.acceptance.GuardEvaluation;
import in.riskgov.domain.acceptance.Posture;
import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.execution.ExecutionDecision;
import in.riskgov.infrastructure.metrics.RiskMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Maps a posture and the current guard evaluations to a notional.
 *
 * A hard breach zeroes the notional regardless of posture when hard blocking is
 * enabled. The reported reason is the first hard-breached guard in guard order,
 * while every hard-breached guard is counted on its own.
 * Stateless; safe to share across streams.
 */
public final class ExecutionRiskGate {
    private static final Logger log = LoggerFactory.getLogger(ExecutionRiskGate.class);

    private final GateConfig config;
    private final RiskMetrics metrics;

    public ExecutionRiskGate(GateConfig config, RiskMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    public ExecutionDecision decide(Posture posture, List<GuardEvaluation> evaluations, double baseNotional) {
        if (config.hardBlockOnGuard()) {
            BlockReason first = null;
            for (GuardEvaluation evaluation : evaluations) {
                if (evaluation.breachedHard()) {
                    BlockReason reason = BlockReason.forGuard(evaluation.guard());
                    metrics.recordBlock(reason);
                    if (first == null) {
                        first = reason;
                    }
                }
            }
            if (first != null) {
                log.debug("[ExecutionRiskGate] Hard guard {} breached, notional forced to 0", first);
                return ExecutionDecision.blocked(first);
            }
        }

        double scale = config.scaleFor(posture);
        if (scale == 0.0) {
            metrics.recordBlock(BlockReason.POSTURE_BLOCK);
            return ExecutionDecision.blocked(BlockReason.POSTURE_BLOCK);
        }
        double base = Double.isFinite(baseNotional) ? Math.max(0.0, baseNotional) : 0.0;
        double notional = clipNotional(base * scale);
        return new ExecutionDecision(notional, scale, null);
    }

    private double clipNotional(double notional) {
        if (notional == 0.0) {
            return 0.0;
        }
        return Math.max(config.minNotional(), Math.min(config.maxNotional(), notional));
    }
}
