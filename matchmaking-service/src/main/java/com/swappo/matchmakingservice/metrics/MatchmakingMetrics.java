package com.swappo.matchmakingservice.metrics;

import com.swappo.matchmakingservice.model.TradeOfferStatus;
import com.swappo.matchmakingservice.resilience.DependencyName;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Matchmaking metrics.
 *
 * Naming convention:
 *   matchmaking.{area}.{metric}
 *
 * Tags:
 *   dependency = catalog | notification | chat
 *   status     = pending | accepted | rejected | cancelled | completed
 *   reason     = circuit_open | remote_error
 *
 * Breaker state gauges read the resilience4j breaker directly.
 */
@Slf4j
@Component
public class MatchmakingMetrics {

    private final MeterRegistry registry;

    private final Counter offersCreated;

    public MatchmakingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.offersCreated = Counter.builder("matchmaking.offers.created")
                .description("Trade offers that passed item validation and were stored")
                .register(registry);
    }

    /**
     * Exposes breaker state as 0=closed, 1=open, 2=half_open.
     */
    public void registerCircuitBreaker(DependencyName dependency, CircuitBreaker circuitBreaker) {
        Gauge.builder("matchmaking.circuit_breaker.state", circuitBreaker, cb -> cb.getState().getOrder())
                .description("Circuit breaker state (0=closed, 1=open, 2=half_open)")
                .tag("dependency", dependency.metricTag())
                .register(registry);
    }

    /**
     * Times one attempt that actually reached the remote side; calls the breaker refused are not timed.
     */
    public <T> T timeRemoteCall(DependencyName dependency, Supplier<T> call) {
        return Timer.builder("matchmaking.dependency.call.duration")
                .description("Remote call duration per attempt")
                .tag("dependency", dependency.metricTag())
                .register(registry)
                .record(call);
    }

    public void recordRetry(DependencyName dependency) {
        registry.counter("matchmaking.dependency.retries", "dependency", dependency.metricTag()).increment();
    }

    public void recordOfferCreated() {
        offersCreated.increment();
    }

    public void recordTransition(TradeOfferStatus newStatus) {
        registry.counter("matchmaking.offers.transitions", "status", newStatus.getValue()).increment();
    }

    public void recordDependencyUnavailable(DependencyName dependency, boolean circuitOpen) {
        registry.counter("matchmaking.dependency.unavailable",
                "dependency", dependency.metricTag(),
                "reason", circuitOpen ? "circuit_open" : "remote_error").increment();
    }

    public void recordSideEffectFailure(DependencyName dependency) {
        registry.counter("matchmaking.side_effects.failed", "dependency", dependency.metricTag()).increment();
    }
}
