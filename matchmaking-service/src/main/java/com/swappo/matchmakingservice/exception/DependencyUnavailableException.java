package com.swappo.matchmakingservice.exception;

import com.swappo.matchmakingservice.resilience.DependencyName;
import lombok.Getter;

/**
 * A gating dependency could not answer: breaker open, retries exhausted
 * or a non-retryable failure. The operation is aborted before any write.
 * HTTP Status: 503 Service Unavailable
 */
@Getter
public class DependencyUnavailableException extends RuntimeException {

    private final DependencyName dependency;

    public DependencyUnavailableException(DependencyName dependency, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
    }
}
