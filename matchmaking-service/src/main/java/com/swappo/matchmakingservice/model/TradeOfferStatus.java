package com.swappo.matchmakingservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum TradeOfferStatus {
    PENDING,    // initial, waiting for the receiver
    ACCEPTED,   // receiver agreed, chat room requested
    REJECTED,   // terminal
    CANCELLED,  // terminal, withdrawn by the proposer
    COMPLETED;  // terminal, items swapped

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TradeOfferStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.getValue().equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trade offer status: " + value));
    }
}
