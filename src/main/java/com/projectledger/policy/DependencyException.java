package com.projectledger.policy;

/**
 * An external collaborator (organisation tree, directory, policy storage)
 * failed.
 */
public class DependencyException extends RuntimeException {

    public DependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
