package com.sankeydsl.writer;

import java.math.BigDecimal;

/**
 * Renders doubles the way people type them: plain notation, no exponent, no trailing zeros
 * ({@code 100}, {@code 29.998}, {@code 1500000000}). The shortest representation that round-trips
 * is used, so parsing the output yields the same double.
 */
public final class NumberFormatter {

    private NumberFormatter() {}

    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
