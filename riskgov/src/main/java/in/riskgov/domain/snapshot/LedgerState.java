package in.riskgov.domain.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import in.riskgov.domain.governance.AlphaLedgerEntry;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerState(double totalBudget, double cumulativeAlpha, List<AlphaLedgerEntry> entries) {

    public LedgerState {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
