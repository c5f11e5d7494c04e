package com.pocketledger.core.model;

import java.util.Locale;

public enum TransactionType {
    INCOME, EXPENSE;

    /**
     * Lower-case wire/storage name ("income" | "expense").
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses "income"/"expense" case-insensitively; returns null for anything else.
     */
    public static TransactionType parse(String s) {
        if (s == null) return null;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "income" -> INCOME;
            case "expense" -> EXPENSE;
            default -> null;
        };
    }
}
