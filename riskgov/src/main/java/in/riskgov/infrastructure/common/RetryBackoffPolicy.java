package in.riskgov.infrastructure.common;

import in.riskgov.config.PersistenceConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff for retrying a failing write.
 *
 * Each failure multiplies the delay (capped at the maximum) and pushes the next
 * permitted attempt into the future. After {@code maxAttempts} consecutive failures
 * the policy gives up until it is reset or a write succeeds.
 *
 * Usage:
 * <pre>
 * if (policy.isReady(now)) {
 *     try {
 *         write();
 *         policy.recordSuccess();
 *     } catch (PersistenceException e) {
 *         policy.recordFailure(now);
 *         if (policy.isExhausted()) { drop(); policy.reset(); }
 *     }
 * }
 * </pre>
 */
public class RetryBackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failures = 0;
    private Duration currentDelay;
    private Instant nextAttemptAt;

    private RetryBackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true if no backoff is pending at {@code now} and the policy is not exhausted
     */
    public synchronized boolean isReady(Instant now) {
        if (isExhausted()) {
            return false;
        }
        return nextAttemptAt == null || !now.isBefore(nextAttemptAt);
    }

    /**
     * Delay that will be applied after the next failure.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    public synchronized void recordFailure(Instant now) {
        failures++;
        nextAttemptAt = now.plus(currentDelay);
        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));
    }

    public synchronized void recordSuccess() {
        failures = 0;
        currentDelay = initialDelay;
        nextAttemptAt = null;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isExhausted() {
        return failures >= maxAttempts;
    }

    public synchronized int getFailureCount() {
        return failures;
    }

    public synchronized Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryBackoffPolicy from(PersistenceConfig config) {
        return builder()
            .initialDelay(Duration.ofMillis(config.retryInitialDelayMs()))
            .maxDelay(Duration.ofMillis(config.retryMaxDelayMs()))
            .multiplier(config.retryMultiplier())
            .maxAttempts(config.retryMaxAttempts())
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(100);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public RetryBackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new RetryBackoffPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
