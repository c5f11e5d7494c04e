package com.pocketledger.core.model;

import java.math.BigDecimal;

public record CategoryTotal(String category, BigDecimal total) {
}
