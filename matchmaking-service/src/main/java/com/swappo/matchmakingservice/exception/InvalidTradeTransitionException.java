package com.swappo.matchmakingservice.exception;

/**
 * Exception thrown when a requested status change is not in the transition table
 * for the offer's current status and the actor's role.
 * For example: the proposer trying to accept their own offer.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidTradeTransitionException extends RuntimeException {

    public InvalidTradeTransitionException(String message) {
        super(message);
    }
}
