package com.swappo.matchmakingservice.event;

import com.swappo.matchmakingservice.model.TradeOfferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Domain event published when a trade offer changes status.
 * Handled by a @TransactionalEventListener, so nothing leaves the service
 * unless the status write has committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeOfferTransitionedEvent {
    private Long offerId;
    private String proposerId;
    private String receiverId;
    private TradeOfferStatus newStatus;
    private String actorId;

    // The party that did not trigger the transition
    public String counterpartyId() {
        return proposerId.equals(actorId) ? receiverId : proposerId;
    }
}
