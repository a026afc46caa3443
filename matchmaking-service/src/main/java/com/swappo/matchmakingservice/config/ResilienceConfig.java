package com.swappo.matchmakingservice.config;

import com.swappo.matchmakingservice.metrics.MatchmakingMetrics;
import com.swappo.matchmakingservice.resilience.DependencyCircuitBreakers;
import com.swappo.matchmakingservice.resilience.DependencyGuardRegistry;
import com.swappo.matchmakingservice.resilience.GuardedDependency;
import com.swappo.matchmakingservice.resilience.RetryPolicy;
import com.swappo.matchmakingservice.resilience.Sleeper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties) {
        return DependencyCircuitBreakers.registry(properties.getFailureThreshold(), properties.getResetTimeout());
    }

    @Bean
    public DependencyGuardRegistry dependencyGuardRegistry(ResilienceProperties properties,
                                                           CircuitBreakerRegistry circuitBreakerRegistry,
                                                           MatchmakingMetrics metrics) {
        DependencyGuardRegistry registry = new DependencyGuardRegistry(dependency -> new GuardedDependency(
                dependency,
                circuitBreakerRegistry.circuitBreaker(dependency.metricTag()),
                new RetryPolicy(properties.getMaxAttempts(), properties.getInitialBackoff(),
                        properties.getMaxBackoff(), Sleeper.THREAD_SLEEP),
                metrics));

        registry.all().forEach(guard -> metrics.registerCircuitBreaker(guard.getDependency(), guard.getCircuitBreaker()));

        log.info("Resilience guards ready: threshold={}, resetTimeout={}s, maxAttempts={}, backoff={}ms..{}ms",
                properties.getFailureThreshold(), properties.getResetTimeout().toSeconds(),
                properties.getMaxAttempts(), properties.getInitialBackoff().toMillis(),
                properties.getMaxBackoff().toMillis());
        return registry;
    }
}
