package com.pocketledger.core.model;

import java.time.LocalDate;

/**
 * Optional criteria for listing a ledger; null fields do not filter.
 * Date bounds are inclusive.
 */
public record TransactionFilter(
        LocalDate dateFrom,
        LocalDate dateTo,
        String category,
        TransactionType type
) {
    public static TransactionFilter all() {
        return new TransactionFilter(null, null, null, null);
    }

    public static TransactionFilter between(LocalDate from, LocalDate to) {
        return new TransactionFilter(from, to, null, null);
    }

    public static TransactionFilter byCategory(String category) {
        return new TransactionFilter(null, null, category, null);
    }

    public static TransactionFilter byType(TransactionType type) {
        return new TransactionFilter(null, null, null, type);
    }
}
