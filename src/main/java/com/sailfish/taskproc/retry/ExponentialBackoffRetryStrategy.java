package com.sailfish.taskproc.retry;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A retry strategy implementing capped exponential backoff with optional jitter.
 * The delay before retry {@code n} (0-based) is {@code initialDelay * multiplier^n}, capped at {@code maxDelay}.
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final boolean addJitter;

    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final long MAX_DELAY_UNITS = 60;

    /**
     * Creates the deterministic policy used by task processor adapters:
     * delays of 1, 2, 4, ... units capped at 60 units, no jitter.
     *
     * @param maxRetries Maximum number of retry attempts.
     * @param unit       The backoff time unit (the first retry delay).
     */
    public static ExponentialBackoffRetryStrategy deterministic(int maxRetries, Duration unit) {
        return new ExponentialBackoffRetryStrategy(maxRetries, unit, DEFAULT_MULTIPLIER, unit.multipliedBy(MAX_DELAY_UNITS), false);
    }

    /**
     * Creates a configurable ExponentialBackoffRetryStrategy.
     *
     * @param maxRetries Maximum number of retry attempts.
     * @param initialDelay Delay before the first retry.
     * @param multiplier Factor by which the delay increases for each subsequent retry.
     * @param maxDelay Optional maximum delay cap. Set to null or Duration.ZERO to disable.
     * @param addJitter If true, adds a random variation of up to 10% to the delay.
     */
    public ExponentialBackoffRetryStrategy(int maxRetries, Duration initialDelay, double multiplier, Duration maxDelay, boolean addJitter) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be non-negative");
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) throw new IllegalArgumentException("initialDelay must be positive");
        if (multiplier <= 1.0) throw new IllegalArgumentException("multiplier must be greater than 1.0");

        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = (maxDelay != null && !maxDelay.isNegative() && !maxDelay.isZero()) ? maxDelay : null;
        this.addJitter = addJitter;
    }

    @Override
    public boolean shouldRetry(int retries) {
        return retries < this.maxRetries;
    }

    @Override
    public Optional<Duration> calculateNextRetryDelay(int retries) {
        if (!shouldRetry(retries)) {
            return Optional.empty();
        }
        return Optional.of(delayFor(retries));
    }

    /**
     * Delay before retry number {@code attempt} (0-based), regardless of the retry limit.
     * Non-decreasing in {@code attempt} when jitter is off.
     */
    public Duration delayFor(int attempt) {
        long delayMillis = initialDelay.toMillis();
        if (attempt > 0) {
            double scaled = initialDelay.toMillis() * Math.pow(multiplier, attempt);
            // the double saturates at Long.MAX_VALUE on overflow
            delayMillis = (long) Math.min(scaled, (double) Long.MAX_VALUE);
        }

        if (maxDelay != null && delayMillis > maxDelay.toMillis()) {
            delayMillis = maxDelay.toMillis();
        }

        // Range [-0.1, 0.1] of the calculated delay
        if (addJitter && delayMillis > 0) {
            long jitter = (long) (delayMillis * 0.1 * (ThreadLocalRandom.current().nextDouble() * 2 - 1));
            delayMillis = Math.max(1, delayMillis + jitter);
        } else if (delayMillis <= 0) {
            delayMillis = 1;
        }
        return Duration.ofMillis(delayMillis);
    }

    public boolean isAddJitter() { return addJitter; }
}
