package in.riskgov.domain.acceptance;

/**
 * The five legal posture transitions. Each has its own counter.
 */
public enum PostureTransition {
    PASS_TO_DERISK(Posture.PASS, Posture.DERISK),
    DERISK_TO_BLOCK(Posture.DERISK, Posture.BLOCK),
    DERISK_TO_PASS(Posture.DERISK, Posture.PASS),
    BLOCK_TO_DERISK(Posture.BLOCK, Posture.DERISK),
    BLOCK_TO_PASS(Posture.BLOCK, Posture.PASS);

    private final Posture from;
    private final Posture to;

    PostureTransition(Posture from, Posture to) {
        this.from = from;
        this.to = to;
    }

    public Posture from() {
        return from;
    }

    public Posture to() {
        return to;
    }

    public String metricLabel() {
        return name().toLowerCase();
    }
}
