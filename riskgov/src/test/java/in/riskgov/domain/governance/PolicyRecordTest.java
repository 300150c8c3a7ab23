package in.riskgov.domain.governance;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PolicyRecordTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T09:00:00Z");
    private static final Instant PROMOTED = Instant.parse("2026-03-02T09:00:00Z");
    private static final Instant LATER = Instant.parse("2026-03-05T09:00:00Z");

    @Test
    void testPromotionStampsPromotedAt() {
        PolicyRecord candidate = new PolicyRecord("p", "1", LifecycleStatus.CANDIDATE, RollingMetrics.empty(),
            CREATED, null);

        PolicyRecord canary = candidate.withStatus(LifecycleStatus.CANARY, PROMOTED);

        assertEquals(LifecycleStatus.CANARY, canary.lifecycleStatus());
        assertEquals(PROMOTED, canary.promotedAt());
        assertEquals(CREATED, canary.createdAt());
    }

    @Test
    void testTerminalTransitionsKeepPromotionTime() {
        PolicyRecord live = new PolicyRecord("p", "1", LifecycleStatus.LIVE, RollingMetrics.empty(),
            CREATED, PROMOTED);

        assertEquals(PROMOTED, live.withStatus(LifecycleStatus.DEPRECATED, LATER).promotedAt(),
            "deprecation must not overwrite the promotion time");
        assertEquals(PROMOTED, live.withStatus(LifecycleStatus.FAILED, LATER).promotedAt(),
            "failure must not overwrite the promotion time");
    }
}
