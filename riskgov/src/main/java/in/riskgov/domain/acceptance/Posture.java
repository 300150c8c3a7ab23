package in.riskgov.domain.acceptance;

/**
 * Acceptance posture of a decision stream.
 */
public enum Posture {
    PASS,
    DERISK,
    BLOCK
}
