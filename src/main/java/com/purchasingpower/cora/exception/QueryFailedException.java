package com.purchasingpower.cora.exception;

/**
 * A query that could not produce any result, not even a degraded one.
 */
public class QueryFailedException extends RuntimeException {

    public QueryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
