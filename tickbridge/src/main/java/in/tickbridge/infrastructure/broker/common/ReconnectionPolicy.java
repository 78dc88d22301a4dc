package in.tickbridge.infrastructure.broker.common;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;

/**
 * Bounded exponential backoff for upstream feed reconnection.
 *
 * Features:
 * - Exponential backoff with configurable multiplier
 * - Cap on the backoff delay
 * - Random jitter added on top of each delay
 * - Attempt budget; once exhausted the circuit opens
 * - Reset to the floor after a successful handshake
 *
 * Usage:
 * <pre>
 * Duration delay = policy.nextDelay();
 * policy.recordFailure();
 * scheduler.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;
    private final Duration maxJitter;
    private final LongUnaryOperator jitterSource;

    private int attemptCount = 0;
    private Duration currentDelay;
    private Instant lastAttemptTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
                               int maxAttempts, Duration maxJitter, LongUnaryOperator jitterSource) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.maxJitter = maxJitter;
        this.jitterSource = jitterSource;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true if another attempt is allowed, false once the circuit is open
     */
    public synchronized boolean shouldRetry() {
        if (circuitOpen) {
            return false;
        }
        return attemptCount < maxAttempts;
    }

    /**
     * Backoff delay before the next attempt, without jitter.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    /**
     * Backoff delay plus a random jitter in {@code [0, maxJitter]}.
     */
    public synchronized Duration nextDelay() {
        long jitterMs = maxJitter.isZero() ? 0 : jitterSource.applyAsLong(maxJitter.toMillis());
        return currentDelay.plusMillis(Math.max(0, Math.min(jitterMs, maxJitter.toMillis())));
    }

    /**
     * Record a failed attempt: grows the delay and opens the circuit when the
     * attempt budget is used up.
     */
    public synchronized void recordFailure() {
        attemptCount++;
        lastAttemptTime = Instant.now();

        long newDelayMillis = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(newDelayMillis, maxDelay.toMillis()));

        if (attemptCount >= maxAttempts) {
            circuitOpen = true;
        }
    }

    /**
     * Record a successful connection: back to the floor, circuit closed.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
        currentDelay = initialDelay;
        lastAttemptTime = null;
        circuitOpen = false;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    /**
     * @return failed attempts since the last success
     */
    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public synchronized Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double multiplier = 2.0;
        private int maxAttempts = 10;
        private Duration maxJitter = Duration.ZERO;
        private LongUnaryOperator jitterSource = bound -> ThreadLocalRandom.current().nextLong(bound + 1);

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

        public Builder maxJitter(Duration maxJitter) {
            if (maxJitter.isNegative()) {
                throw new IllegalArgumentException("Jitter must not be negative");
            }
            this.maxJitter = maxJitter;
            return this;
        }

        /**
         * Source of jitter: receives the bound in millis, returns a value in {@code [0, bound]}.
         */
        public Builder jitterSource(LongUnaryOperator jitterSource) {
            this.jitterSource = jitterSource;
            return this;
        }

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts,
                maxJitter, jitterSource);
        }
    }
}
