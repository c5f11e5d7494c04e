package com.pocketledger.cli;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Money {
    private Money() {
    }

    static String format(BigDecimal amount) {
        BigDecimal v = amount.setScale(2, RoundingMode.HALF_UP);
        return v.signum() < 0
                ? "-$" + v.negate().toPlainString()
                : "$" + v.toPlainString();
    }
}
