package in.riskgov.service.governance;

/**
 * Uniform share shrunk as the ledger fills: share / (1 + allocations / stepScale).
 */
public final class AlphaDecreasingSpendingPolicy implements AlphaSpendingPolicy {

    private final double stepScale;

    public AlphaDecreasingSpendingPolicy(double stepScale) {
        if (!(stepScale > 0.0)) {
            throw new IllegalArgumentException("stepScale must be positive, got " + stepScale);
        }
        this.stepScale = stepScale;
    }

    @Override
    public double allowance(SpendingContext context) {
        double share = context.totalBudget() / context.expectedTests();
        return share / (1.0 + context.allocations() / stepScale);
    }
}
