package com.swappo.matchmakingservice.lifecycle;

import com.swappo.matchmakingservice.model.TradeOfferStatus;
import lombok.Getter;

import java.util.Optional;

/**
 * Fixed notification copy sent to the other party when an offer reaches a status.
 */
@Getter
public enum TradeNotificationTemplate {

    ACCEPTED("trade_offer_accepted",
            "Trade Offer Accepted! 🎉",
            "Great news! Your trade offer has been accepted."),
    REJECTED("trade_offer_rejected",
            "Trade Offer Declined",
            "Your trade offer was declined. Keep exploring!"),
    CANCELLED("trade_offer_cancelled",
            "Trade Offer Cancelled",
            "A trade offer you received has been cancelled."),
    COMPLETED("trade_completed",
            "Trade Completed! ✅",
            "Congratulations! Your trade has been completed.");

    private final String type;
    private final String title;
    private final String body;

    TradeNotificationTemplate(String type, String title, String body) {
        this.type = type;
        this.title = title;
        this.body = body;
    }

    public static Optional<TradeNotificationTemplate> forStatus(TradeOfferStatus status) {
        return switch (status) {
            case ACCEPTED -> Optional.of(ACCEPTED);
            case REJECTED -> Optional.of(REJECTED);
            case CANCELLED -> Optional.of(CANCELLED);
            case COMPLETED -> Optional.of(COMPLETED);
            case PENDING -> Optional.empty();
        };
    }
}
