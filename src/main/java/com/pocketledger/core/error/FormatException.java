package com.pocketledger.core.error;

/**
 * A backup document that cannot be restored as-is.
 */
public class FormatException extends FinanceException {
    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
