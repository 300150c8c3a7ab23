package in.riskgov.service.governance;

/**
 * Inputs to an alpha spending policy.
 *
 * @param testIndex   1-based index of the test within its tester
 * @param allocations ledger-wide allocations made before this one
 */
public record SpendingContext(double totalBudget, int expectedTests, int testIndex, int allocations) {
}
