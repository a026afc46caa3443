package com.swappo.matchmakingservice.client;

import com.swappo.matchmakingservice.resilience.DependencyName;
import com.swappo.matchmakingservice.resilience.RemoteCallException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient failures onto {@link RemoteCallException} with a retryable flag.
 */
final class RemoteCallErrors {

    // Same set the gateway retries on: timeouts, throttling and server-side errors
    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 429, 500, 502, 503, 504);

    private RemoteCallErrors() {
    }

    static RemoteCallException translate(DependencyName dependency, Throwable ex) {
        if (ex instanceof RemoteCallException remote) {
            return remote;
        }
        if (ex instanceof WebClientResponseException responseEx) {
            int status = responseEx.getStatusCode().value();
            boolean retryable = RETRYABLE_STATUSES.contains(status) || responseEx.getStatusCode().is5xxServerError();
            return new RemoteCallException(dependency, retryable,
                    dependency.metricTag() + " responded HTTP " + status, ex);
        }
        if (ex instanceof WebClientRequestException) {
            return new RemoteCallException(dependency, true,
                    dependency.metricTag() + " unreachable: " + ex.getMessage(), ex);
        }
        if (ex instanceof TimeoutException) {
            return new RemoteCallException(dependency, true,
                    dependency.metricTag() + " timed out", ex);
        }
        return new RemoteCallException(dependency, false,
                dependency.metricTag() + " call failed: " + ex.getMessage(), ex);
    }
}
