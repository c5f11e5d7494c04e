package com.pocketledger.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Portable copy of one user's ledger and budgets, as written to a backup file.
 */
public record Snapshot(
        @JsonProperty("formatVersion") int formatVersion,
        @JsonProperty("username") String username,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("transactions") List<TransactionEntry> transactions,
        @JsonProperty("budgets") List<BudgetEntry> budgets
) {
    public static final int CURRENT_VERSION = 1;

    public record TransactionEntry(
            @JsonProperty("id") Long id,
            @JsonProperty("type") String type,          // income | expense
            @JsonProperty("amount") BigDecimal amount,
            @JsonProperty("category") String category,
            @JsonProperty("description") String description,
            @JsonProperty("date") LocalDate date
    ) {
    }

    public record BudgetEntry(
            @JsonProperty("category") String category,
            @JsonProperty("year") Integer year,
            @JsonProperty("month") Integer month,       // 1..12
            @JsonProperty("threshold") BigDecimal threshold
    ) {
    }
}
