package com.pocketledger.core.error;

public class NotFoundException extends FinanceException {
    public NotFoundException(String message) {
        super(message);
    }
}
