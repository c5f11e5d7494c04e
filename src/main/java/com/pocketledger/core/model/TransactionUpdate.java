package com.pocketledger.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Partial update of a transaction. Null fields keep their current value.
 */
public record TransactionUpdate(
        TransactionType type,
        BigDecimal amount,
        String category,
        String description,
        LocalDate date
) {
    public boolean isEmpty() {
        return type == null && amount == null && category == null && description == null && date == null;
    }

    public Transaction applyTo(Transaction t) {
        return new Transaction(
                t.id(),
                t.userId(),
                type != null ? type : t.type(),
                amount != null ? amount : t.amount(),
                category != null ? category.trim() : t.category(),
                description != null ? description.trim() : t.description(),
                date != null ? date : t.date()
        );
    }
}
