package com.example.clusteragent.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Pure delay computation for retries: {@code min(initial * multiplier^attempt, max)},
 * optionally perturbed by up to +/- jitter.
 */
public final class Backoff {

    private Backoff() {
    }

    /**
     * Delay in milliseconds before retry number {@code attempt} (0-based).
     */
    public static long delay(int attempt, BackoffConfig config) {
        return delay(attempt, config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Same as {@link #delay(int, BackoffConfig)} with an explicit source of uniform
     * randoms in [0, 1), so jitter can be checked deterministically.
     */
    public static long delay(int attempt, BackoffConfig config, DoubleSupplier random) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative: " + attempt);
        }
        double raw = config.initialDelayMs() * Math.pow(config.multiplier(), attempt);
        double capped = Math.min(raw, config.maxDelayMs());
        if (config.jitter() == 0.0) {
            return Math.round(capped);
        }
        double factor = 1.0 + config.jitter() * (2.0 * random.getAsDouble() - 1.0);
        return Math.max(0L, Math.round(capped * factor));
    }
}
