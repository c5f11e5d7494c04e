package com.pocketledger.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Transaction(
        long id,
        long userId,
        TransactionType type,
        BigDecimal amount,
        String category,
        String description,
        LocalDate date
) {
    public boolean isExpense() {
        return type == TransactionType.EXPENSE;
    }
}
