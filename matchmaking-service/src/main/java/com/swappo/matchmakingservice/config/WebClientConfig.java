package com.swappo.matchmakingservice.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * One WebClient per dependency, each bound to its own base URL.
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final DependencyProperties dependencyProperties;

    @Bean
    public WebClient catalogWebClient(WebClient.Builder builder) {
        return build(builder, dependencyProperties.getCatalogBaseUrl());
    }

    @Bean
    public WebClient notificationWebClient(WebClient.Builder builder) {
        return build(builder, dependencyProperties.getNotificationBaseUrl());
    }

    @Bean
    public WebClient chatWebClient(WebClient.Builder builder) {
        return build(builder, dependencyProperties.getChatBaseUrl());
    }

    private WebClient build(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, dependencyProperties.getConnectTimeoutMs())
                .responseTimeout(dependencyProperties.getTimeout());

        // clone(): the injected builder is shared, keep base URLs from leaking between clients
        return builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
