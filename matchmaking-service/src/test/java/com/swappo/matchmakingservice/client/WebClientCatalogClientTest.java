package com.swappo.matchmakingservice.client;

import com.swappo.common.contracts.ItemValidationResponseContract;
import com.swappo.matchmakingservice.config.DependencyProperties;
import com.swappo.matchmakingservice.resilience.RemoteCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class WebClientCatalogClientTest {

    private DependencyProperties properties;
    private AtomicReference<ClientRequest> lastRequest;

    @BeforeEach
    void setUp() {
        properties = new DependencyProperties();
        properties.setTimeout(Duration.ofMillis(200));
        lastRequest = new AtomicReference<>();
    }

    private WebClientCatalogClient clientReturning(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://catalog.test")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return exchange.exchange(request);
                })
                .build();
        return new WebClientCatalogClient(webClient, properties);
    }

    private static ExchangeFunction status(HttpStatus status) {
        return request -> Mono.just(ClientResponse.create(status).build());
    }

    @Test
    void validateItems_ParsesSnakeCaseReply() {
        String body = "{\"validations\":["
                + "{\"item_id\":1,\"exists\":true,\"is_active\":true,\"owner_id\":\"alice\"},"
                + "{\"item_id\":2,\"exists\":true,\"is_active\":false,\"owner_id\":\"bob\"}"
                + "]}";
        WebClientCatalogClient client = clientReturning(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build()));

        ItemValidationResponseContract response = client.validateItems(List.of(1L, 2L));

        assertThat(response.getValidations()).hasSize(2);
        assertThat(response.getValidations().get(0).isActive()).isTrue();
        assertThat(response.getValidations().get(0).getOwnerId()).isEqualTo("alice");
        assertThat(response.getValidations().get(1).isActive()).isFalse();
        assertThat(lastRequest.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/v1/items/validate");
    }

    @Test
    void validateItems_ServerError_IsRetryable() {
        RemoteCallException ex = catchThrowableOfType(
                () -> clientReturning(status(HttpStatus.SERVICE_UNAVAILABLE)).validateItems(List.of(1L)),
                RemoteCallException.class);

        assertThat(ex.isRetryable()).isTrue();
        assertThat(ex.getMessage()).isEqualTo("catalog responded HTTP 503");
    }

    @Test
    void validateItems_Throttled_IsRetryable() {
        RemoteCallException ex = catchThrowableOfType(
                () -> clientReturning(status(HttpStatus.TOO_MANY_REQUESTS)).validateItems(List.of(1L)),
                RemoteCallException.class);

        assertThat(ex.isRetryable()).isTrue();
    }

    @Test
    void validateItems_ClientError_IsNotRetryable() {
        RemoteCallException ex = catchThrowableOfType(
                () -> clientReturning(status(HttpStatus.BAD_REQUEST)).validateItems(List.of(1L)),
                RemoteCallException.class);

        assertThat(ex.isRetryable()).isFalse();
    }

    @Test
    void validateItems_ConnectionRefused_IsRetryable() {
        WebClientCatalogClient client = clientReturning(request -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), HttpMethod.POST,
                URI.create("http://catalog.test/api/v1/items/validate"), HttpHeaders.EMPTY)));

        RemoteCallException ex = catchThrowableOfType(() -> client.validateItems(List.of(1L)), RemoteCallException.class);

        assertThat(ex.isRetryable()).isTrue();
    }

    @Test
    void validateItems_Timeout_IsRetryable() {
        WebClientCatalogClient client = clientReturning(request -> Mono.never());

        RemoteCallException ex = catchThrowableOfType(() -> client.validateItems(List.of(1L)), RemoteCallException.class);

        assertThat(ex.isRetryable()).isTrue();
        assertThat(ex.getMessage()).isEqualTo("catalog timed out");
    }
}
