package com.pocketledger.core.model;

import java.math.BigDecimal;
import java.util.List;

public record Report(
        ReportPeriod period,
        DateRange range,
        BigDecimal totalIncome,
        BigDecimal totalExpenses,
        List<CategoryTotal> expensesByCategory // total desc, then category asc
) {
    public BigDecimal savings() {
        return totalIncome.subtract(totalExpenses);
    }
}
