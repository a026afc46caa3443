package com.swappo.matchmakingservice.resilience;

import com.swappo.matchmakingservice.metrics.MatchmakingMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * One dependency's breaker and retry policy composed in a fixed order:
 * retry outside, breaker inside. Every attempt re-enters the breaker.
 */
@Slf4j
public class GuardedDependency {

    private final DependencyName dependency;
    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final MatchmakingMetrics metrics;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant openedAt;

    public GuardedDependency(DependencyName dependency,
                             CircuitBreaker circuitBreaker,
                             RetryPolicy retryPolicy,
                             MatchmakingMetrics metrics) {
        this.dependency = dependency;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;

        circuitBreaker.getEventPublisher()
                .onSuccess(event -> consecutiveFailures.set(0))
                .onError(event -> consecutiveFailures.incrementAndGet())
                .onStateTransition(event -> {
                    CircuitBreaker.State next = event.getStateTransition().getToState();
                    if (next == CircuitBreaker.State.OPEN) {
                        openedAt = event.getCreationTime().toInstant();
                    } else if (next == CircuitBreaker.State.CLOSED) {
                        consecutiveFailures.set(0);
                        openedAt = null;
                    }
                    log.warn("Circuit breaker [{}] state change: {}", dependency.metricTag(), event.getStateTransition());
                });
    }

    /**
     * @throws CircuitOpenException if the breaker refused the (first or a later) attempt
     * @throws RemoteCallException  if the last attempt failed or the failure was not retryable
     */
    public <T> T execute(Supplier<T> remoteCall) {
        Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker,
                () -> metrics.timeRemoteCall(dependency, remoteCall));
        AtomicInteger attempts = new AtomicInteger();

        return retryPolicy.withRetry(() -> {
            if (attempts.incrementAndGet() > 1) {
                metrics.recordRetry(dependency);
            }
            try {
                return guarded.get();
            } catch (CallNotPermittedException e) {
                throw new CircuitOpenException(dependency, e);
            }
        }, RemoteCallException::isRetryable);
    }

    public DependencyHealth health() {
        return DependencyHealth.builder()
                .dependency(dependency)
                .state(circuitBreaker.getState())
                .consecutiveFailures(consecutiveFailures.get())
                .openedAt(openedAt)
                .build();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public DependencyName getDependency() {
        return dependency;
    }
}
