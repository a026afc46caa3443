package com.swappo.matchmakingservice.dto;

import com.swappo.matchmakingservice.model.TradeOfferStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradeOfferStatusUpdateRequest {

    @NotNull(message = "Status cannot be null")
    private TradeOfferStatus status;
}
