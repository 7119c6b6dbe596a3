package com.projectledger.contract;

/**
 * Raised when a command, input or state transition is invalid.
 * Mapped to HTTP 400.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
