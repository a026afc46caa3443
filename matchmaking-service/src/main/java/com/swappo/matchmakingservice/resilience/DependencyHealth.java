package com.swappo.matchmakingservice.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time snapshot of one dependency's breaker.
 * The live state is owned by {@link GuardedDependency}; this copy is read-only.
 */
@Value
@Builder
public class DependencyHealth {
    DependencyName dependency;
    CircuitBreaker.State state;
    int consecutiveFailures;
    // null unless the breaker has tripped at least once since it last closed
    Instant openedAt;
}
