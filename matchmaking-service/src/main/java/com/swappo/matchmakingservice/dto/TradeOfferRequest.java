package com.swappo.matchmakingservice.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Offer proposal. Supports one-for-one, many-for-one and many-for-many trades.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TradeOfferRequest {

    @NotBlank(message = "Proposer ID cannot be blank")
    @Size(max = 100, message = "Proposer ID must be at most 100 characters")
    private String proposerId;

    @NotBlank(message = "Receiver ID cannot be blank")
    @Size(max = 100, message = "Receiver ID must be at most 100 characters")
    private String receiverId;

    @NotEmpty(message = "Offer must contain at least one offered item")
    private List<@NotNull Long> offeredItemIds;

    @NotEmpty(message = "Offer must request at least one item")
    private List<@NotNull Long> requestedItemIds;

    @Size(max = 1000, message = "Message must be at most 1000 characters")
    private String message;
}
