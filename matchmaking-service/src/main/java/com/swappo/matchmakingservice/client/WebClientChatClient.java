package com.swappo.matchmakingservice.client;

import com.swappo.common.contracts.ChatRoomRequestContract;
import com.swappo.matchmakingservice.config.DependencyProperties;
import com.swappo.matchmakingservice.resilience.DependencyName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Slf4j
@Component
public class WebClientChatClient implements ChatClient {

    static final String CHAT_ROOMS_PATH = "/api/v1/chat-rooms";

    private final WebClient chatWebClient;
    private final Duration timeout;

    public WebClientChatClient(@Qualifier("chatWebClient") WebClient chatWebClient,
                               DependencyProperties dependencyProperties) {
        this.chatWebClient = chatWebClient;
        this.timeout = dependencyProperties.getTimeout();
    }

    @Override
    public void createRoom(ChatRoomRequestContract chatRoom) {
        chatWebClient.post()
                .uri(CHAT_ROOMS_PATH)
                .bodyValue(chatRoom)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .onErrorMap(ex -> RemoteCallErrors.translate(DependencyName.CHAT, ex))
                .block();

        log.debug("Chat room accepted: offerId={}", chatRoom.getTradeOfferId());
    }
}
