package com.lending.scope.geography;

/**
 * Thrown when the lender has no matching records (or no branch locations) for the requested
 * years and filters.
 */
public class NoActivityException extends ScopeResolutionException {

    public NoActivityException(String message) {
        super(message);
    }

    public NoActivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
