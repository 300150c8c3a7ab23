package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Process-wide governance state: the alpha ledger and the policy lifecycle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GovernanceSnapshot(
    String schema,
    int version,
    Instant savedAt,
    LedgerState ledger,
    LifecycleState lifecycle
) {
    public static final String SCHEMA = "riskgov.governance";
    public static final int CURRENT_VERSION = 1;
    public static final String KEY = "governance";
}
