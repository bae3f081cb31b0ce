package com.querycache.service;

/**
 * Thrown when a query source is neither a {@code .sql} file reference nor read-only SQL text.
 */
public class QueryValidationException extends IllegalArgumentException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public QueryValidationException(String message) {
        super(message);
    }
}
