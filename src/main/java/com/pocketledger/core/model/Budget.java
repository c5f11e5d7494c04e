package com.pocketledger.core.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record Budget(
        long id,
        long userId,
        String category,
        YearMonth period,
        BigDecimal threshold
) {
}
