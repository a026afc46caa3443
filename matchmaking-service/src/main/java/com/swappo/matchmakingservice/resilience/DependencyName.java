package com.swappo.matchmakingservice.resilience;

/**
 * Remote services the matchmaking service depends on.
 * Each one gets its own circuit breaker, never shared.
 */
public enum DependencyName {
    CATALOG,        // item existence / activity / ownership lookups (gating)
    NOTIFICATION,   // user notifications (best effort)
    CHAT;           // chat room provisioning (best effort)

    public String metricTag() {
        return name().toLowerCase();
    }
}
