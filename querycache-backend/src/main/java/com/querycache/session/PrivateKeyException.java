package com.querycache.session;

/**
 * Thrown when a configured private key cannot be read or decrypted.
 */
public class PrivateKeyException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public PrivateKeyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public PrivateKeyException(String message) {
        super(message);
    }
}
