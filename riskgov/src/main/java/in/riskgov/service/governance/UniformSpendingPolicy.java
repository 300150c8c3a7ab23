package in.riskgov.service.governance;

/**
 * Equal share per expected test.
 */
public final class UniformSpendingPolicy implements AlphaSpendingPolicy {

    @Override
    public double allowance(SpendingContext context) {
        return context.totalBudget() / context.expectedTests();
    }
}
