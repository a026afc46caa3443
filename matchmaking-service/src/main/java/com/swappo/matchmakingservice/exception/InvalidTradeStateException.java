package com.swappo.matchmakingservice.exception;

/**
 * Exception thrown when an operation other than a transition is not possible
 * in the offer's current status. For example: deleting an accepted offer.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidTradeStateException extends RuntimeException {

    public InvalidTradeStateException(String message) {
        super(message);
    }
}
