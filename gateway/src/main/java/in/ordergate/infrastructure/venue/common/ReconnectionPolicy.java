package in.ordergate.infrastructure.venue.common;

import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff for venue connect attempts.
 *
 * Each failure multiplies the delay (capped at maxDelay); after
 * maxAttempts consecutive failures the circuit opens and
 * {@link #shouldRetry()} stays false until {@link #recordSuccess()} or
 * {@link #reset()}.
 *
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .initialDelay(Duration.ofMillis(500))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .multiplier(2.0)
 *     .maxAttempts(5)
 *     .build();
 * connector.connect(Duration.ofSeconds(5), policy);
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failedAttempts = 0;
    private Duration currentDelay;
    private Instant lastFailureTime;
    private boolean circuitOpen = false;

    private ReconnectionPolicy(Duration initialDelay, Duration maxDelay,
                               double multiplier, int maxAttempts) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
        this.currentDelay = initialDelay;
    }

    /**
     * @return true while the circuit is closed and attempts remain
     */
    public synchronized boolean shouldRetry() {
        return !circuitOpen && failedAttempts < maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration getNextDelay() {
        return currentDelay;
    }

    public synchronized void recordFailure() {
        failedAttempts++;
        lastFailureTime = Instant.now();

        long grown = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(grown, maxDelay.toMillis()));

        if (failedAttempts >= maxAttempts) {
            circuitOpen = true;
        }
    }

    public synchronized void recordSuccess() {
        failedAttempts = 0;
        currentDelay = initialDelay;
        lastFailureTime = null;
        circuitOpen = false;
    }

    /**
     * Manually close the circuit.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    /**
     * Sleep for the current backoff delay.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void awaitNextAttempt() throws InterruptedException {
        Thread.sleep(getNextDelay().toMillis());
    }

    public synchronized boolean isCircuitOpen() {
        return circuitOpen;
    }

    public synchronized int getFailedAttempts() {
        return failedAttempts;
    }

    public synchronized Instant getLastFailureTime() {
        return lastFailureTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy for the venue connector: 500ms doubling up to 30s, 5 attempts.
     */
    public static ReconnectionPolicy forVenue() {
        return builder()
            .initialDelay(Duration.ofMillis(500))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(2.0)
            .maxAttempts(5)
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(30);
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
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier cannot be below 1.0");
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

        public ReconnectionPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new ReconnectionPolicy(initialDelay, maxDelay, multiplier, maxAttempts);
        }
    }
}
