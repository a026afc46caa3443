package com.swappo.matchmakingservice.model;

import java.util.Optional;

/**
 * Role an acting user plays on a specific offer.
 */
public enum TradeRole {
    PROPOSER,
    RECEIVER;

    /**
     * Empty when the user is neither party of the offer.
     */
    public static Optional<TradeRole> of(TradeOffer offer, String actorId) {
        if (actorId == null) {
            return Optional.empty();
        }
        if (actorId.equals(offer.getProposerId())) {
            return Optional.of(PROPOSER);
        }
        if (actorId.equals(offer.getReceiverId())) {
            return Optional.of(RECEIVER);
        }
        return Optional.empty();
    }

    public String getValue() {
        return name().toLowerCase();
    }
}
