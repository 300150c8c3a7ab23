package in.riskgov.domain.execution;

/**
 * Gate output for one cycle.
 *
 * @param blockReason null unless the gate zeroed the notional
 */
public record ExecutionDecision(double recommendedNotional, double riskScale, BlockReason blockReason) {

    public static ExecutionDecision blocked(BlockReason reason) {
        return new ExecutionDecision(0.0, 0.0, reason);
    }

    public boolean isBlocked() {
        return blockReason != null;
    }
}
