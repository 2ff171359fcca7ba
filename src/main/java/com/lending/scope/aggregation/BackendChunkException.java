package com.lending.scope.aggregation;

/**
 * Wraps the failure of one aggregation chunk. Inside {@code aggregate} it is caught and recorded on the
 * result; callers raise it when every chunk of an aggregation failed.
 */
public class BackendChunkException extends RuntimeException {

    public BackendChunkException(String message) {
        super(message);
    }

    public BackendChunkException(String message, Throwable cause) {
        super(message, cause);
    }
}
