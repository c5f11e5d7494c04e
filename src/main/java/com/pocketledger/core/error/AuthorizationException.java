package com.pocketledger.core.error;

public class AuthorizationException extends FinanceException {
    public AuthorizationException(String message) {
        super(message);
    }
}
