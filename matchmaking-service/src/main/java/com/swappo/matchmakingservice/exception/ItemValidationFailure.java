package com.swappo.matchmakingservice.exception;

/**
 * Item checks, in the order they are evaluated. Only the first failing one is reported.
 */
public enum ItemValidationFailure {
    ITEMS_NOT_FOUND,
    ITEMS_INACTIVE,
    WRONG_OWNER
}
