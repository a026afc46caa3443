package com.swappo.common.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Contract for the chat service's create-room endpoint.
 * One room per accepted trade offer, shared by proposer and receiver.
 */
@Data
@Builder
public class ChatRoomRequestContract {

    @JsonProperty("trade_offer_id")
    private Long tradeOfferId;

    @JsonProperty("user1_id")
    private String userAId;

    @JsonProperty("user2_id")
    private String userBId;
}
