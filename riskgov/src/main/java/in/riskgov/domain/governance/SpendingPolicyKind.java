package in.riskgov.domain.governance;

/**
 * How a test's share of the global alpha budget is computed.
 */
public enum SpendingPolicyKind {
    UNIFORM,
    ALPHA_DECREASING,
    FDR_LINEAR
}
