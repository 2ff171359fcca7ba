package com.lending.scope.geography;

/**
 * Thrown when a custom geography list is empty after trimming and de-duplication.
 */
public class EmptyScopeException extends ScopeResolutionException {

    public EmptyScopeException(String message) {
        super(message);
    }

    public EmptyScopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
