package com.pocketledger.core.model;

import java.time.LocalDate;

/**
 * Inclusive calendar range.
 */
public record DateRange(LocalDate from, LocalDate to) {
}
