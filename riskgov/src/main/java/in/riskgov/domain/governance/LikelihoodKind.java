package in.riskgov.domain.governance;

/**
 * Likelihood family of the sequential test.
 */
public enum LikelihoodKind {
    /** Gaussian with known variance. */
    GAUSSIAN,
    /** Gaussian with unknown variance, plug-in running estimate. */
    GLR
}
