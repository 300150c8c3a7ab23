package in.riskgov.domain.governance;

/**
 * Promotion stages of a policy variant. DEPRECATED and FAILED are terminal.
 */
public enum LifecycleStatus {
    CANDIDATE,
    CANARY,
    SHADOW,
    LIVE,
    DEPRECATED,
    FAILED;

    public boolean isTerminal() {
        return this == DEPRECATED || this == FAILED;
    }

    /**
     * Stages that run a promotion test.
     */
    public boolean isUnderTest() {
        return this == CANARY || this == SHADOW;
    }
}
