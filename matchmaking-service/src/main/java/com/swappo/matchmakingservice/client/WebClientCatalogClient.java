package com.swappo.matchmakingservice.client;

import com.swappo.common.contracts.ItemValidationRequestContract;
import com.swappo.common.contracts.ItemValidationResponseContract;
import com.swappo.matchmakingservice.config.DependencyProperties;
import com.swappo.matchmakingservice.resilience.DependencyName;
import com.swappo.matchmakingservice.resilience.RemoteCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

@Slf4j
@Component
public class WebClientCatalogClient implements CatalogClient {

    static final String VALIDATE_PATH = "/api/v1/items/validate";

    private final WebClient catalogWebClient;
    private final Duration timeout;

    public WebClientCatalogClient(@Qualifier("catalogWebClient") WebClient catalogWebClient,
                                  DependencyProperties dependencyProperties) {
        this.catalogWebClient = catalogWebClient;
        this.timeout = dependencyProperties.getTimeout();
    }

    @Override
    public ItemValidationResponseContract validateItems(List<Long> itemIds) {
        log.debug("Validating {} items via catalog service", itemIds.size());

        ItemValidationResponseContract response = catalogWebClient.post()
                .uri(VALIDATE_PATH)
                .bodyValue(new ItemValidationRequestContract(itemIds))
                .retrieve()
                .bodyToMono(ItemValidationResponseContract.class)
                .timeout(timeout)
                .onErrorMap(ex -> RemoteCallErrors.translate(DependencyName.CATALOG, ex))
                .block();

        if (response == null || response.getValidations() == null) {
            throw new RemoteCallException(DependencyName.CATALOG, false, "catalog returned an empty validation response");
        }
        return response;
    }
}
