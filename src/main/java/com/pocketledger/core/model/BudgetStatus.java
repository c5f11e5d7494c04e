package com.pocketledger.core.model;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Read-time comparison of a budget with what was actually spent. Never stored.
 */
public record BudgetStatus(
        String category,
        YearMonth period,
        BigDecimal spent,
        BigDecimal threshold
) {
    public boolean exceeded() {
        return spent.compareTo(threshold) > 0;
    }

    public BigDecimal remaining() {
        return threshold.subtract(spent);
    }
}
