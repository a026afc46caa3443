package com.swappo.matchmakingservice.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff.
 *
 * The wait after failed attempt n is {@code min(maxBackoff, initialBackoff * 2^(n-1))}.
 * A {@link CircuitOpenException} is surfaced immediately and never retried.
 * Wraps a breaker call, so every attempt re-enters the breaker.
 */
@Slf4j
public class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(10);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initialBackoff <= maxBackoff");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.sleeper = sleeper;
    }

    public RetryPolicy(Sleeper sleeper) {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF, sleeper);
    }

    public <T> T withRetry(Supplier<T> operation, Predicate<Throwable> isRetryable) {
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (CircuitOpenException e) {
                throw e;
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !isRetryable.test(e)) {
                    throw e;
                }
                Duration wait = backoffAfter(attempt);
                log.warn("Attempt {}/{} failed, retrying in {}ms: {}", attempt, maxAttempts, wait.toMillis(), e.getMessage());
                pause(wait, e);
            }
        }
    }

    /**
     * Backoff to apply after the given (1-based) failed attempt.
     */
    public Duration backoffAfter(int attempt) {
        long factor = 1L << Math.min(attempt - 1, 30);
        Duration candidate = initialBackoff.multipliedBy(factor);
        return candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
    }

    private void pause(Duration wait, RuntimeException lastFailure) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            lastFailure.addSuppressed(ie);
            throw lastFailure;
        }
    }
}
