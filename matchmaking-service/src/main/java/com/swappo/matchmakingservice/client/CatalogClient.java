package com.swappo.matchmakingservice.client;

import com.swappo.common.contracts.ItemValidationResponseContract;

import java.util.List;

/**
 * Raw, unguarded access to the catalog service.
 * Implementations throw {@link com.swappo.matchmakingservice.resilience.RemoteCallException} on failure.
 */
public interface CatalogClient {

    ItemValidationResponseContract validateItems(List<Long> itemIds);
}
