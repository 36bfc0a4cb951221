package in.castsync.infrastructure.obs.supervisor;

import java.time.Duration;

/**
 * Exponential backoff for reconnecting to the control endpoint.
 *
 * Features:
 * - Delay starts at {@code initialDelay} and is multiplied after every failure, up to {@code maxDelay}
 * - Optional attempt limit; 0 retries forever
 * - Gives up permanently after {@link #recordFatal()} until {@link #reset()}
 *
 * Usage:
 * <pre>
 * Duration delay = policy.getNextDelay();
 * policy.recordFailure();
 * if (policy.shouldRetry()) {
 *     scheduler.schedule(this::attempt, delay.toMillis(), TimeUnit.MILLISECONDS);
 * }
 * </pre>
 */
public final class ReconnectionPolicy {

    public static final int UNLIMITED = 0;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;
    private Duration currentDelay;
    private boolean exhausted = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    public synchronized boolean shouldRetry() {
        if (exhausted) {
            return false;
        }
        return maxAttempts == UNLIMITED || attemptCount < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    public synchronized void recordFailure() {
        attemptCount++;
        long next = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
    }

    /**
     * A failure that retrying cannot fix, such as rejected credentials.
     */
    public synchronized void recordFatal() {
        exhausted = true;
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        exhausted = false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized boolean isExhausted() {
        return exhausted || (maxAttempts != UNLIMITED && attemptCount >= maxAttempts);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        private double multiplier = 2.0;
        private int maxAttempts = UNLIMITED;

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
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        /**
         * @param maxAttempts consecutive failures before giving up; {@link #UNLIMITED} for no limit
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("Max attempts must not be negative");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
