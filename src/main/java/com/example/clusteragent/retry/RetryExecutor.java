package com.example.clusteragent.retry;

import com.example.clusteragent.error.AgentException;
import com.example.clusteragent.error.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Runs an operation, retrying retryable failures with exponential backoff.
 * The first attempt never sleeps; after {@code retryCount} retries the last
 * failure is surfaced.
 */
@Slf4j
public class RetryExecutor {

    private final Sleeper sleeper;

    public RetryExecutor() {
        this(Sleeper.THREAD);
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public <T> T withRetry(Callable<T> operation, Predicate<Throwable> isRetryable,
                           int retryCount, BackoffConfig backoff) {
        return withRetry("operation", operation, isRetryable, retryCount, backoff);
    }

    public <T> T withRetry(String operationName, Callable<T> operation, Predicate<Throwable> isRetryable,
                           int retryCount, BackoffConfig backoff) {
        if (retryCount < 0) {
            throw new IllegalArgumentException("Retry count must not be negative: " + retryCount);
        }
        int attempt = 0;
        while (true) {
            try {
                return operation.call();
            } catch (Exception e) {
                if (attempt >= retryCount || !isRetryable.test(e)) {
                    if (attempt > 0) {
                        log.warn("{} failed after {} attempts: {}", operationName, attempt + 1, e.getMessage());
                    }
                    throw surface(operationName, e);
                }
                long delayMs = Backoff.delay(attempt, backoff);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operationName, attempt + 1, retryCount + 1, delayMs, e.getMessage());
                pause(operationName, delayMs);
                attempt++;
            }
        }
    }

    private void pause(String operationName, long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AgentException(ErrorKind.INTERNAL, "Interrupted while waiting to retry " + operationName, ie);
        }
    }

    private static RuntimeException surface(String operationName, Exception e) {
        if (e instanceof RuntimeException runtime) {
            return runtime;
        }
        return AgentException.transientFailure(operationName + " failed: " + e.getMessage(), e);
    }
}
