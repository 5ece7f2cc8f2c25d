package com.example.clusteragent.retry;

/**
 * Exponential backoff parameters.
 *
 * @param initialDelayMs delay before the first retry
 * @param multiplier     growth factor applied per attempt
 * @param maxDelayMs     upper bound on the un-jittered delay
 * @param jitter         fraction in [0, 1] by which the delay may be perturbed either way
 */
public record BackoffConfig(long initialDelayMs, double multiplier, long maxDelayMs, double jitter) {

    public BackoffConfig {
        if (initialDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1, got " + multiplier);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("Backoff jitter must be within [0, 1], got " + jitter);
        }
    }

    public static BackoffConfig of(long initialDelayMs, double multiplier, long maxDelayMs) {
        return new BackoffConfig(initialDelayMs, multiplier, maxDelayMs, 0.0);
    }

    public BackoffConfig withJitter(double jitter) {
        return new BackoffConfig(initialDelayMs, multiplier, maxDelayMs, jitter);
    }
}
