package com.swappo.matchmakingservice.config;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Where the remote dependencies live and how long a single call may take.
 */
@Slf4j
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "matchmaking.dependencies")
public class DependencyProperties {

    private String catalogBaseUrl;
    private String notificationBaseUrl;
    private String chatBaseUrl;

    /**
     * Upper bound for one remote call attempt, independent of retry backoff.
     * Default: 5s
     */
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * TCP connect timeout in milliseconds.
     * Default: 2000
     */
    private int connectTimeoutMs = 2000;

    @PostConstruct
    public void validate() {
        requireUrl("catalog-base-url", catalogBaseUrl);
        requireUrl("notification-base-url", notificationBaseUrl);
        requireUrl("chat-base-url", chatBaseUrl);
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("matchmaking.dependencies.timeout must be > 0");
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException("matchmaking.dependencies.connect-timeout-ms must be > 0");
        }

        log.info("Dependencies: catalog={}, notification={}, chat={}, timeout={}ms",
                catalogBaseUrl, notificationBaseUrl, chatBaseUrl, timeout.toMillis());
    }

    private static void requireUrl(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("matchmaking.dependencies." + name + " must be set");
        }
    }
}
