package in.riskgov.domain.common;

/**
 * Thrown when a spend is recorded that does not fit the remaining global alpha budget.
 */
public class BudgetExceededException extends RuntimeException {

    private final String testId;
    private final double requested;
    private final double remaining;

    public BudgetExceededException(String testId, double requested, double remaining) {
        super(String.format("[%s] alpha spend %.6f exceeds remaining budget %.6f", testId, requested, remaining));
        this.testId = testId;
        this.requested = requested;
        this.remaining = remaining;
    }

    public String getTestId() {
        return testId;
    }

    public double getRequested() {
        return requested;
    }

    public double getRemaining() {
        return remaining;
    }
}
