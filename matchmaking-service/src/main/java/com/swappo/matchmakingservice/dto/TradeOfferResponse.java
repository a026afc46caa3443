package com.swappo.matchmakingservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.swappo.matchmakingservice.model.TradeOfferStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeOfferResponse {
    private Long id;
    private String proposerId;
    private String receiverId;
    private List<Long> offeredItemIds;
    private List<Long> requestedItemIds;
    private TradeOfferStatus status;
    private String message;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant respondedAt;
}
