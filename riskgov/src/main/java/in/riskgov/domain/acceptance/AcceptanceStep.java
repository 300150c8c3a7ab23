package in.riskgov.domain.acceptance;

import java.util.List;

/**
 * Result of one state machine step.
 *
 * @param transition null when the posture did not change
 */
public record AcceptanceStep(Posture posture, PostureTransition transition, List<GuardEvaluation> evaluations) {

    public AcceptanceStep {
        evaluations = List.copyOf(evaluations);
    }

    public boolean anyHardBreach() {
        return evaluations.stream().anyMatch(GuardEvaluation::breachedHard);
    }
}
