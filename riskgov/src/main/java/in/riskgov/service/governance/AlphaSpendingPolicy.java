package in.riskgov.service.governance;

import in.riskgov.config.LedgerConfig;

/**
 * Computes the per-test significance allowance. Policies never spend; the ledger
 * stays the single authority on what is actually consumed.
 */
public interface AlphaSpendingPolicy {

    double allowance(SpendingContext context);

    static AlphaSpendingPolicy from(LedgerConfig config) {
        switch (config.spendingPolicy()) {
            case UNIFORM:
                return new UniformSpendingPolicy();
            case ALPHA_DECREASING:
                return new AlphaDecreasingSpendingPolicy(config.stepScale());
            case FDR_LINEAR:
                return new FdrLinearSpendingPolicy();
            default:
                throw new IllegalArgumentException("Unknown spending policy " + config.spendingPolicy());
        }
    }
}
