package in.riskgov.domain.acceptance;

/**
 * Per-cycle uncertainty composite. All components lie in [0, 1], higher is worse.
 */
public record UncertaintyScore(
    double kappa,
    double kappaPlus,
    double stateU,
    double modelU,
    double forecastU,
    double bccEstimate
) {
}
