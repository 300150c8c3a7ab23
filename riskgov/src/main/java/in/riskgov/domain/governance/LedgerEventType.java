package in.riskgov.domain.governance;

/**
 * Kind of alpha ledger entry. Only ALLOCATE consumes budget; the others record outcomes.
 */
public enum LedgerEventType {
    ALLOCATE,
    ACCEPT_H1,
    ACCEPT_H0,
    ABANDON
}
