package in.riskgov.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.riskgov.domain.governance.SpendingPolicyKind;

import static in.riskgov.config.ConfigChecks.require;
import static in.riskgov.config.ConfigChecks.requireNonNull;
import static in.riskgov.config.ConfigChecks.requirePositive;
import static in.riskgov.config.ConfigChecks.requireProbability;

/**
 * Global alpha budget and spending policy.
 */
public record LedgerConfig(
    @JsonProperty("totalBudget")
    double totalBudget,

    @JsonProperty("expectedTests")
    int expectedTests,

    @JsonProperty("spendingPolicy")
    SpendingPolicyKind spendingPolicy,

    @JsonProperty("stepScale")
    double stepScale,           // alpha-decreasing policy: shrink rate per ledger allocation

    @JsonProperty("tolerance")
    double tolerance            // float slack allowed on the budget comparison
) {
    public static LedgerConfig defaults() {
        return new LedgerConfig(0.05, 20, SpendingPolicyKind.UNIFORM, 10.0, 1e-12);
    }

    public void validate() {
        requireProbability(totalBudget, "ledger.totalBudget");
        require(expectedTests >= 1, "ledger.expectedTests", "must be at least 1");
        requireNonNull(spendingPolicy, "ledger.spendingPolicy");
        requirePositive(stepScale, "ledger.stepScale");
        require(tolerance >= 0.0 && tolerance < 1e-6, "ledger.tolerance", "must lie in [0, 1e-6)");
    }
}
