package in.riskgov.domain.governance;

import java.time.Instant;

/**
 * Immutable, append-only record of one ledger event.
 */
public record AlphaLedgerEntry(
    String testId,
    double alphaSpent,
    double cumulativeAlpha,
    LedgerEventType eventType,
    Instant recordedAt
) {
}
