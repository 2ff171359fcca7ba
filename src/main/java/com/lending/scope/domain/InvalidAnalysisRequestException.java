package com.lending.scope.domain;

/**
 * Thrown when an analysis request is malformed (missing lender, invalid years). Raised before any
 * backend call is made.
 */
public class InvalidAnalysisRequestException extends RuntimeException {

    public InvalidAnalysisRequestException(String message) {
        super(message);
    }

    public InvalidAnalysisRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
