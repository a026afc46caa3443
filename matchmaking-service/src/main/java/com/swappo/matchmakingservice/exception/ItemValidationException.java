package com.swappo.matchmakingservice.exception;

import com.swappo.matchmakingservice.model.TradeRole;
import lombok.Getter;

import java.util.List;

/**
 * Items of a proposed trade failed catalog checks.
 * Carries every offending id of the first failing category.
 */
@Getter
public class ItemValidationException extends RuntimeException {

    private final ItemValidationFailure failure;
    private final List<Long> itemIds;
    // only set for WRONG_OWNER: whose items were expected
    private final TradeRole role;

    private ItemValidationException(ItemValidationFailure failure, List<Long> itemIds, TradeRole role, String message) {
        super(message);
        this.failure = failure;
        this.itemIds = List.copyOf(itemIds);
        this.role = role;
    }

    public static ItemValidationException notFound(List<Long> itemIds) {
        return new ItemValidationException(ItemValidationFailure.ITEMS_NOT_FOUND, itemIds, null,
                "Items not found: " + itemIds);
    }

    public static ItemValidationException inactive(List<Long> itemIds) {
        return new ItemValidationException(ItemValidationFailure.ITEMS_INACTIVE, itemIds, null,
                "Items are not active: " + itemIds);
    }

    public static ItemValidationException wrongOwner(List<Long> itemIds, TradeRole role) {
        String message = role == TradeRole.PROPOSER
                ? "Proposer does not own offered items: " + itemIds
                : "Receiver does not own requested items: " + itemIds;
        return new ItemValidationException(ItemValidationFailure.WRONG_OWNER, itemIds, role, message);
    }
}
