package com.swappo.matchmakingservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

/**
 * Counts of offers a user takes part in, as proposer or receiver.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeStatisticsResponse {
    private long totalOffers;
    private long pendingOffers;
    private long acceptedOffers;
    private long rejectedOffers;
    private long completedOffers;
}
