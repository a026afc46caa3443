package com.swappo.matchmakingservice.client;

import com.swappo.common.contracts.NotificationRequestContract;
import com.swappo.matchmakingservice.config.DependencyProperties;
import com.swappo.matchmakingservice.resilience.DependencyName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Slf4j
@Component
public class WebClientNotificationClient implements NotificationClient {

    static final String NOTIFICATIONS_PATH = "/api/v1/notifications";

    private final WebClient notificationWebClient;
    private final Duration timeout;

    public WebClientNotificationClient(@Qualifier("notificationWebClient") WebClient notificationWebClient,
                                       DependencyProperties dependencyProperties) {
        this.notificationWebClient = notificationWebClient;
        this.timeout = dependencyProperties.getTimeout();
    }

    @Override
    public void send(NotificationRequestContract notification) {
        notificationWebClient.post()
                .uri(NOTIFICATIONS_PATH)
                .bodyValue(notification)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .onErrorMap(ex -> RemoteCallErrors.translate(DependencyName.NOTIFICATION, ex))
                .block();

        log.debug("Notification accepted: recipient={}, type={}, offerId={}",
                notification.getRecipientId(), notification.getType(), notification.getRelatedOfferId());
    }
}
