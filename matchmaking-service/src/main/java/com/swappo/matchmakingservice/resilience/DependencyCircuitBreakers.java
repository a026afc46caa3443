package com.swappo.matchmakingservice.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;

import java.time.Duration;

/**
 * Breaker configuration shared by every dependency.
 *
 * A count-based window exactly {@code failureThreshold} calls long that only trips at a 100%
 * failure rate opens after that many consecutive failures; one success anywhere in the window
 * keeps it closed. Open breakers never move to half-open on a timer: the first call made after
 * the wait becomes the single permitted probe.
 */
public final class DependencyCircuitBreakers {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RESET_TIMEOUT = Duration.ofSeconds(60);

    private DependencyCircuitBreakers() {
    }

    public static CircuitBreakerConfig consecutiveFailureConfig(int failureThreshold, Duration resetTimeout) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (resetTimeout == null || resetTimeout.toMillis() < 1) {
            throw new IllegalArgumentException("resetTimeout must be at least 1ms");
        }
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(resetTimeout)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
    }

    public static CircuitBreakerRegistry registry(int failureThreshold, Duration resetTimeout) {
        return CircuitBreakerRegistry.of(consecutiveFailureConfig(failureThreshold, resetTimeout));
    }

    public static CircuitBreakerRegistry defaultRegistry() {
        return registry(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RESET_TIMEOUT);
    }
}
