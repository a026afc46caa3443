package com.swappo.common.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Contract for the notification service's create-notification endpoint.
 *
 * Sent when a trade offer changes status, always to the party that did NOT
 * perform the change.
 */
@Data
@Builder
public class NotificationRequestContract {

    @JsonProperty("user_id")
    private String recipientId;

    // trade_offer_accepted, trade_offer_rejected, trade_offer_cancelled, trade_completed
    @JsonProperty("type")
    private String type;

    @JsonProperty("title")
    private String title;

    @JsonProperty("body")
    private String body;

    @JsonProperty("related_offer_id")
    private Long relatedOfferId;

    // the user who performed the status change
    @JsonProperty("related_user_id")
    private String relatedUserId;
}
