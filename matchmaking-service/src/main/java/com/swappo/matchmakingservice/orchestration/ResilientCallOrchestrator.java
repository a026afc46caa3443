package com.swappo.matchmakingservice.orchestration;

import com.swappo.common.contracts.ChatRoomRequestContract;
import com.swappo.common.contracts.ItemValidationResponseContract;
import com.swappo.common.contracts.NotificationRequestContract;
import com.swappo.matchmakingservice.client.CatalogClient;
import com.swappo.matchmakingservice.client.ChatClient;
import com.swappo.matchmakingservice.client.NotificationClient;
import com.swappo.matchmakingservice.exception.DependencyUnavailableException;
import com.swappo.matchmakingservice.metrics.MatchmakingMetrics;
import com.swappo.matchmakingservice.resilience.CircuitOpenException;
import com.swappo.matchmakingservice.resilience.DependencyGuardRegistry;
import com.swappo.matchmakingservice.resilience.DependencyName;
import com.swappo.matchmakingservice.resilience.RemoteCallException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Single entry point for every remote call the service makes.
 *
 * Each call runs through the dependency's own retry policy and circuit breaker.
 * Catalog failures propagate as {@link DependencyUnavailableException} because they gate
 * offer creation; notification and chat failures are logged and counted, never thrown,
 * because they follow a transition that is already committed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResilientCallOrchestrator {

    private final CatalogClient catalogClient;
    private final NotificationClient notificationClient;
    private final ChatClient chatClient;
    private final DependencyGuardRegistry guardRegistry;
    private final MatchmakingMetrics metrics;

    /**
     * Returns one verdict per distinct requested id, in request order.
     * Ids the catalog did not mention come back as {@code exists=false}.
     *
     * @throws DependencyUnavailableException if the catalog cannot answer
     */
    public List<ItemVerdict> validateItems(Collection<Long> itemIds) {
        List<Long> requested = itemIds.stream().distinct().collect(Collectors.toList());

        ItemValidationResponseContract response;
        try {
            response = guardRegistry.guard(DependencyName.CATALOG)
                    .execute(() -> catalogClient.validateItems(requested));
        } catch (CircuitOpenException e) {
            log.warn("Catalog circuit breaker is OPEN, rejecting item validation for {} items", requested.size());
            metrics.recordDependencyUnavailable(DependencyName.CATALOG, true);
            throw new DependencyUnavailableException(DependencyName.CATALOG,
                    "Catalog service unavailable - circuit breaker open", e);
        } catch (RemoteCallException e) {
            log.error("Catalog item validation failed: itemIds={}, error={}", requested, e.getMessage());
            metrics.recordDependencyUnavailable(DependencyName.CATALOG, false);
            throw new DependencyUnavailableException(DependencyName.CATALOG, "Catalog service unavailable", e);
        }

        Map<Long, ItemVerdict> byId = new HashMap<>();
        for (ItemValidationResponseContract.ItemValidation validation : response.getValidations()) {
            if (validation.getItemId() != null) {
                byId.put(validation.getItemId(), new ItemVerdict(validation.getItemId(),
                        validation.isExists(), validation.isActive(), validation.getOwnerId()));
            }
        }

        return requested.stream()
                .map(id -> byId.getOrDefault(id, ItemVerdict.notFound(id)))
                .collect(Collectors.toList());
    }

    /**
     * Best effort: false if the notification could not be delivered.
     */
    public boolean notify(NotificationRequestContract notification) {
        try {
            guardRegistry.guard(DependencyName.NOTIFICATION).execute(() -> {
                notificationClient.send(notification);
                return Boolean.TRUE;
            });
            log.info("Notification sent: recipient={}, type={}, offerId={}",
                    notification.getRecipientId(), notification.getType(), notification.getRelatedOfferId());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to send notification: recipient={}, type={}, offerId={}, error={}",
                    notification.getRecipientId(), notification.getType(), notification.getRelatedOfferId(),
                    e.getMessage());
            metrics.recordSideEffectFailure(DependencyName.NOTIFICATION);
            return false;
        }
    }

    /**
     * Best effort: false if the room could not be created.
     */
    public boolean provisionChatRoom(ChatRoomRequestContract chatRoom) {
        try {
            guardRegistry.guard(DependencyName.CHAT).execute(() -> {
                chatClient.createRoom(chatRoom);
                return Boolean.TRUE;
            });
            log.info("Chat room created: offerId={}", chatRoom.getTradeOfferId());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to create chat room: offerId={}, error={}", chatRoom.getTradeOfferId(), e.getMessage());
            metrics.recordSideEffectFailure(DependencyName.CHAT);
            return false;
        }
    }
}
