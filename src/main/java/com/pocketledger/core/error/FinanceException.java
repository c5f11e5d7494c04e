package com.pocketledger.core.error;

/**
 * Base of every failure the menu reports back to the user.
 */
public abstract class FinanceException extends RuntimeException {
    protected FinanceException(String message) {
        super(message);
    }

    protected FinanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
