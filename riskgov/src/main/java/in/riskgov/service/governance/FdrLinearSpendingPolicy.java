package in.riskgov.service.governance;

/**
 * Benjamini-Hochberg style linear ramp: (k / m) * budget / m for the k-th of m tests.
 */
public final class FdrLinearSpendingPolicy implements AlphaSpendingPolicy {

    @Override
    public double allowance(SpendingContext context) {
        int m = context.expectedTests();
        int k = Math.max(1, Math.min(context.testIndex(), m));
        return ((double) k / m) * (context.totalBudget() / m);
    }
}
