package com.swappo.common.exception;

/**
 * Thrown when the acting user is not a party allowed to perform the operation,
 * e.g. a stranger touching someone else's trade offer.
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
