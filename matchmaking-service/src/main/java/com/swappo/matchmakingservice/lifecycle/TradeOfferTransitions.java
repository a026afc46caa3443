package com.swappo.matchmakingservice.lifecycle;

import com.swappo.matchmakingservice.model.TradeOfferStatus;
import com.swappo.matchmakingservice.model.TradeRole;

/**
 * Transition table of the trade offer lifecycle.
 *
 * <pre>
 * PENDING  -> CANCELLED  by proposer
 * PENDING  -> ACCEPTED   by receiver
 * PENDING  -> REJECTED   by receiver
 * ACCEPTED -> COMPLETED  by either party
 * </pre>
 *
 * Everything else is refused. The switches are exhaustive on purpose: adding a status
 * does not compile until every pair has been decided.
 */
public final class TradeOfferTransitions {

    private TradeOfferTransitions() {
    }

    public static boolean isAllowed(TradeOfferStatus current, TradeOfferStatus target, TradeRole role) {
        return switch (current) {
            case PENDING -> switch (target) {
                case CANCELLED -> role == TradeRole.PROPOSER;
                case ACCEPTED, REJECTED -> role == TradeRole.RECEIVER;
                case PENDING, COMPLETED -> false;
            };
            case ACCEPTED -> switch (target) {
                case COMPLETED -> true;
                case PENDING, ACCEPTED, REJECTED, CANCELLED -> false;
            };
            case REJECTED, CANCELLED, COMPLETED -> false;
        };
    }

    /**
     * True for the receiver's answer, the only transitions that stamp respondedAt.
     */
    public static boolean isResponse(TradeOfferStatus current, TradeOfferStatus target) {
        return current == TradeOfferStatus.PENDING
                && (target == TradeOfferStatus.ACCEPTED || target == TradeOfferStatus.REJECTED);
    }
}
