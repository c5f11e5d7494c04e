package com.pocketledger.core.error;

public class ValidationException extends FinanceException {
    public ValidationException(String message) {
        super(message);
    }
}
