package com.swappo.matchmakingservice.config;

import com.swappo.matchmakingservice.resilience.DependencyCircuitBreakers;
import com.swappo.matchmakingservice.resilience.RetryPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Breaker and retry settings, applied identically to every dependency.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "matchmaking.resilience")
public class ResilienceProperties {

    /**
     * Consecutive failures that trip a breaker open.
     */
    private int failureThreshold = DependencyCircuitBreakers.DEFAULT_FAILURE_THRESHOLD;

    /**
     * How long an open breaker waits before letting a probe through.
     */
    private Duration resetTimeout = DependencyCircuitBreakers.DEFAULT_RESET_TIMEOUT;

    /**
     * Total attempts per logical call, initial attempt included.
     */
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;

    private Duration initialBackoff = RetryPolicy.DEFAULT_INITIAL_BACKOFF;

    private Duration maxBackoff = RetryPolicy.DEFAULT_MAX_BACKOFF;
}
