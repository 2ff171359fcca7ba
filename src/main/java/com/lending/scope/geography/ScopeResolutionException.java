package com.lending.scope.geography;

/**
 * Base type for failures that leave a lender without a usable geographic scope.
 */
public class ScopeResolutionException extends RuntimeException {

    public ScopeResolutionException(String message) {
        super(message);
    }

    public ScopeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
