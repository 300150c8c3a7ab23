package in.riskgov.domain.governance;

/**
 * Observable progress of the running sequential test.
 */
public record SequentialTestState(double logLikelihoodRatio, int nSamples, SequentialDecision decision) {

    public static SequentialTestState initial() {
        return new SequentialTestState(0.0, 0, SequentialDecision.CONTINUE);
    }
}
