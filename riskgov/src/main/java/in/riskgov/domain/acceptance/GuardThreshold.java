package in.riskgov.domain.acceptance;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Soft and hard limit of one guard.
 */
public record GuardThreshold(
    @JsonProperty("soft") double soft,
    @JsonProperty("hard") double hard
) {
    public static GuardThreshold of(double soft, double hard) {
        return new GuardThreshold(soft, hard);
    }

    /**
     * The soft limit must trip no later than the hard one.
     */
    public boolean isOrderedFor(GuardKind kind) {
        if (!Double.isFinite(soft) || !Double.isFinite(hard)) {
            return false;
        }
        return kind.isLowerBound() ? soft >= hard : soft <= hard;
    }
}
