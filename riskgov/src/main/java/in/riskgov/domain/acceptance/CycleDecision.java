package in.riskgov.domain.acceptance;

import in.riskgov.domain.execution.BlockReason;
import in.riskgov.domain.forecast.IntervalPrediction;

import java.time.Instant;
import java.util.List;

/**
 * Per-cycle decision handed to the execution layer.
 *
 * @param stale true when the cycle ran over budget and this is the previous decision
 */
public record CycleDecision(
    String streamId,
    Instant timestamp,
    Posture posture,
    double riskScale,
    double recommendedNotional,
    BlockReason blockReason,
    double kappa,
    double kappaPlus,
    double alphaCurrent,
    double coverageEma,
    IntervalPrediction interval,
    List<GuardEvaluation> guardEvaluations,
    PostureTransition transition,
    boolean stale
) {
    public CycleDecision {
        guardEvaluations = guardEvaluations == null ? List.of() : List.copyOf(guardEvaluations);
    }

    public CycleDecision asStale(Instant at) {
        return new CycleDecision(streamId, at, posture, riskScale, recommendedNotional, blockReason, kappa,
            kappaPlus, alphaCurrent, coverageEma, interval, guardEvaluations, null, true);
    }
}
