package in.riskgov.domain.acceptance;

/**
 * Value of one guard in one cycle, checked against its thresholds.
 */
public record GuardEvaluation(
    GuardKind guard,
    double value,
    double softThreshold,
    double hardThreshold,
    boolean breachedSoft,
    boolean breachedHard
) {
    public static GuardEvaluation evaluate(GuardKind guard, double value, GuardThreshold threshold) {
        boolean hard = guard.breaches(value, threshold.hard());
        boolean soft = hard || guard.breaches(value, threshold.soft());
        return new GuardEvaluation(guard, value, threshold.soft(), threshold.hard(), soft, hard);
    }
}
