package com.projectledger.contract;

/**
 * Raised when a referenced project, event or policy does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
