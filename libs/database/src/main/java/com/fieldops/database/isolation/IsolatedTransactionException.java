package com.fieldops.database.isolation;

/**
 * Thrown when an isolated transaction cannot be started, committed or rolled back, or when it is
 * abandoned because the calling thread was interrupted.
 */
public class IsolatedTransactionException extends RuntimeException {

    public IsolatedTransactionException(String message) {
        super(message);
    }

    public IsolatedTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
