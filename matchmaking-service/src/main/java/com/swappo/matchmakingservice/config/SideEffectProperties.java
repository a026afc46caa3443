package com.swappo.matchmakingservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Sizing of the pool that runs post-commit notifications and chat provisioning.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "matchmaking.side-effects")
public class SideEffectProperties {

    private int corePoolSize = 4;
    private int maxPoolSize = 16;
    private int queueCapacity = 500;
}
