package com.stockgame.domain.vo;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and formatting for game money. Every stored price and cash balance passes through
 * {@link #round(BigDecimal)}, so amounts always carry exactly two decimals.
 */
public final class Money {

    public static final int SCALE = 2;

    public static final BigDecimal HUNDRED = new BigDecimal("100");

    private Money() {}

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal of(String amount) {
        return round(new BigDecimal(amount));
    }

    public static BigDecimal of(long amount) {
        return round(BigDecimal.valueOf(amount));
    }

    /** Renders an amount as {@code $1234.50}; the sign is dropped. */
    public static String format(BigDecimal amount) {
        return "$" + round(amount.abs()).toPlainString();
    }
}
