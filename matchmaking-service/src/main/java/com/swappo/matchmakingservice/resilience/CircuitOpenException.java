package com.swappo.matchmakingservice.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.Getter;

/**
 * Thrown instead of invoking the remote call while a breaker is open,
 * or while a half-open breaker already has its probe in flight.
 * Never retried.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final DependencyName dependency;

    public CircuitOpenException(DependencyName dependency, CallNotPermittedException cause) {
        super("Circuit breaker [" + dependency.metricTag() + "] rejected the call: " + cause.getMessage(), cause);
        this.dependency = dependency;
    }
}
