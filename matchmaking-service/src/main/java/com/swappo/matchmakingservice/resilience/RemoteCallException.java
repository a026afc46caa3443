package com.swappo.matchmakingservice.resilience;

import lombok.Getter;

/**
 * Failure of a single remote call, already classified.
 *
 * retryable = transient transport trouble (connect refused, timeout, 5xx, 408, 429).
 * Anything else (4xx, unreadable body) is permanent for this attempt.
 */
@Getter
public class RemoteCallException extends RuntimeException {

    private final DependencyName dependency;
    private final boolean retryable;

    public RemoteCallException(DependencyName dependency, boolean retryable, String message) {
        super(message);
        this.dependency = dependency;
        this.retryable = retryable;
    }

    public RemoteCallException(DependencyName dependency, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.dependency = dependency;
        this.retryable = retryable;
    }

    public static boolean isRetryable(Throwable failure) {
        return failure instanceof RemoteCallException remote && remote.isRetryable();
    }
}
