package com.pocketledger.core.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;

public enum ReportPeriod {
    MONTHLY, YEARLY;

    public DateRange boundsFor(LocalDate reference) {
        return switch (this) {
            case MONTHLY -> {
                YearMonth ym = YearMonth.from(reference);
                yield new DateRange(ym.atDay(1), ym.atEndOfMonth());
            }
            case YEARLY -> new DateRange(
                    LocalDate.of(reference.getYear(), 1, 1),
                    LocalDate.of(reference.getYear(), 12, 31));
        };
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReportPeriod parse(String s) {
        if (s == null) return null;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "monthly" -> MONTHLY;
            case "yearly" -> YEARLY;
            default -> null;
        };
    }
}
